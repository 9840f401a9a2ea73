package com.gt.lift.model;

import java.util.List;
import java.util.Optional;

// One parsed LIFT file: header plus entries in document order
public record LiftDocument(String producer, LiftHeader header, List<Entry> entries) {

    public LiftDocument {
        header = header == null ? LiftHeader.EMPTY : header;
        entries = Models.listOf(entries);
    }

    public LiftDocument(LiftHeader header, List<Entry> entries) {
        this(null, header, entries);
    }

    public Optional<Entry> findEntry(String entryId) {
        return entries.stream().filter(entry -> entryId.equals(entry.id())).findFirst();
    }

    public LiftDocument withEntries(List<Entry> entries) {
        return new LiftDocument(producer, header, entries);
    }

    public LiftDocument withHeader(LiftHeader header) {
        return new LiftDocument(producer, header, entries);
    }
}
