package com.gt.lift.document;

import com.gt.lift.model.Entry;

import java.util.UUID;

/**
 * Entry ids are the headword followed by a short UUID, e.g. {@code cat_1b4e28ba-2fa1-11d2}, so they stay
 * readable in relation refs. Sense ids are full UUIDs.
 */
public class ShortUuidIdentifierGenerator implements IdentifierGenerator {

    private static final int SHORT_UUID_LENGTH = 18;       // 8 bytes total, e.g. xxxxxxxx-xxxx-xxxx
    private static final String DEFAULT_HEADWORD = "entry";

    @Override
    public String entryId(Entry entry) {
        String headword = entry.headword().strip().replaceAll("\\s+", "_");
        return (headword.isEmpty() ? DEFAULT_HEADWORD : headword) + "_" + newShortUUID();
    }

    @Override
    public String senseId() {
        return UUID.randomUUID().toString();
    }

    public static String newShortUUID() {
        return UUID.randomUUID().toString().substring(0, SHORT_UUID_LENGTH);
    }
}
