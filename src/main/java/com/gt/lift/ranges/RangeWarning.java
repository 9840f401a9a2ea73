package com.gt.lift.ranges;

/**
 * A value that is not listed in the range it should come from.
 *
 * @param entryId  entry holding the value
 * @param location where in the entry the value sits, e.g. {@code sense[s1]/grammatical-info}
 * @param rangeId  range the value was checked against
 * @param value    the unlisted value
 */
public record RangeWarning(String entryId, String location, String rangeId, String value) {

    public String message() {
        return "Entry " + entryId + ": '" + value + "' at " + location + " is not in range " + rangeId;
    }
}
