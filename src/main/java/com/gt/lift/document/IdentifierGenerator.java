package com.gt.lift.document;

import com.gt.lift.model.Entry;

// Supplies ids for entries and senses that arrive without one
public interface IdentifierGenerator {

    String entryId(Entry entry);

    String senseId();
}
