package com.parlayarchitect.intake;

import lombok.Value;

/**
 * An upstream record quarantined at the intake boundary, with the first problem found.
 *
 * <p>{@code recordId} is null when the record had no usable id.
 */
@Value
public class MalformedRecord {

    int position;
    String recordId;
    String problem;

    @Override
    public String toString() {
        return "#" + position + (recordId != null ? " (" + recordId + ")" : "") + ": " + problem;
    }
}
