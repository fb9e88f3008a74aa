package com.aigreentick.services.setupwizard.constants;

/**
 * Which wizard step created a row, so that clearing a step
 * deletes exactly the rows it inserted.
 */
public enum RecordOrigin {
    SETUP_WIZARD,
    SAMPLE_DATA
}
