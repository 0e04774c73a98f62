package com.ai.clinicdesk.conversation;

public enum GreetingKind {
    HELLO,
    THANKS,
    GOODBYE
}
