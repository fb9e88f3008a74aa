package com.aigreentick.services.setupwizard.constants;

public enum PersonRole {
    ADMINISTRATOR,
    STAFF,
    PARENT,
    STUDENT
}
