package com.ai.clinicdesk.conversation;

public enum InfoTopic {
    DOCTOR,
    SERVICE,
    BRANCH,
    HOURS,
    CONTACT
}
