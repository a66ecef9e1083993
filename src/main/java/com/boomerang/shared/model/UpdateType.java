package com.boomerang.shared.model;

public enum UpdateType {
    MESSAGE_RECEIVED(MessageReceived.class),
    MESSAGE_ECHOED(MessageEchoed.class),
    DELIVERY_CONFIRMED(DeliveryConfirmed.class),
    READ_CONFIRMED(ReadConfirmed.class),
    POSTBACK_RECEIVED(PostbackReceived.class),
    OPTIN_RECEIVED(OptinReceived.class),
    REFERRAL_RECEIVED(ReferralReceived.class),
    ACCOUNT_LINKING_RECEIVED(AccountLinkingReceived.class);

    private final Class<? extends Update> variant;

    UpdateType(Class<? extends Update> variant) {
        this.variant = variant;
    }

    public Class<? extends Update> variant() {
        return variant;
    }

    public static UpdateType of(Class<? extends Update> variant) {
        for (var type : values()) {
            if (type.variant == variant) return type;
        }
        throw new IllegalArgumentException("Not a concrete update variant: " + variant.getName());
    }
}
