package com.ai.clinicdesk.conversation;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}
