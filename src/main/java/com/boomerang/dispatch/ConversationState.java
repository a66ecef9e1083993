package com.boomerang.dispatch;

public enum ConversationState { IDLE, PROCESSING }
