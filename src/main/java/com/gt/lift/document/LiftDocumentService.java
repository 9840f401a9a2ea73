package com.gt.lift.document;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.generator.LiftGenerator;
import com.gt.lift.model.Entry;
import com.gt.lift.model.LiftDocument;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;
import com.gt.lift.parser.LiftParseResult;
import com.gt.lift.parser.LiftParser;
import com.gt.lift.parser.ParseIssue;
import com.gt.lift.ranges.RangeValidator;
import com.gt.lift.ranges.RangeWarning;
import com.gt.lift.ranges.RangesService;
import com.gt.lift.store.LiftStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@Component
public class LiftDocumentService {

    private static final Logger log = LoggerFactory.getLogger(LiftDocumentService.class);

    private final LiftStore liftStore;
    private final LiftParser liftParser;
    private final LiftGenerator liftGenerator;
    private final IdentifierGenerator identifierGenerator;
    private final RangesService rangesService;
    private final RangeValidator rangeValidator;

    @Autowired
    public LiftDocumentService(LiftStore liftStore,
                               LiftParser liftParser,
                               LiftGenerator liftGenerator,
                               IdentifierGenerator identifierGenerator,
                               RangesService rangesService,
                               RangeValidator rangeValidator) {
        this.liftStore = liftStore;
        this.liftParser = liftParser;
        this.liftGenerator = liftGenerator;
        this.identifierGenerator = identifierGenerator;
        this.rangesService = rangesService;
        this.rangeValidator = rangeValidator;
    }

    public LiftParseResult load(String name) throws LiftParseException {
        LiftParseResult result = liftParser.parse(liftStore.read(name));
        for (ParseIssue issue : result.issues()) {
            log.warn("{} in {} at {}: {}", issue.type(), name, issue.path(), issue.message());
        }
        return result;
    }

    public void save(String name, LiftDocument document) {
        liftStore.write(name, liftGenerator.generateBytes(document));
    }

    /**
     * Fills absent entry and sense ids. Present ids are never changed, so relation refs stay valid.
     */
    public LiftDocument assignMissingIds(LiftDocument document) {
        int assigned = 0;
        List<Entry> entries = new ArrayList<>();
        for (Entry entry : document.entries()) {
            Entry updated = entry;
            if (entry.id() == null || entry.id().isBlank()) {
                updated = updated.withId(identifierGenerator.entryId(entry));
                assigned++;
            }

            List<Sense> senses = assignMissingSenseIds(updated.senses());
            if (!senses.equals(updated.senses())) {
                updated = updated.withSenses(senses);
            }
            entries.add(updated);
        }

        if (assigned > 0) {
            log.info("Assigned ids to {} entries", assigned);
        }
        return document.withEntries(entries);
    }

    private List<Sense> assignMissingSenseIds(List<Sense> senses) {
        List<Sense> updated = new ArrayList<>();
        for (Sense sense : senses) {
            Sense.Builder builder = sense.toBuilder();
            if (sense.id() == null || sense.id().isBlank()) {
                builder.id(identifierGenerator.senseId());
            }
            builder.clearSubsenses();
            assignMissingSenseIds(sense.subsenses()).forEach(builder::subsense);
            updated.add(builder.build());
        }
        return updated;
    }

    // Sorted distinct language tags of every multitext in the document
    public List<String> languageCodes(LiftDocument document) {
        TreeSet<String> languages = new TreeSet<>();
        new LiftDocumentWalker(multitext -> languages.addAll(multitext.languages()), traits -> { }).walk(document);
        return List.copyOf(languages);
    }

    // Sorted distinct values of a trait wherever it appears, for selection lists when no ranges are loaded
    public List<String> traitValues(LiftDocument document, String traitName) {
        TreeSet<String> values = new TreeSet<>();
        new LiftDocumentWalker(multitext -> { }, traits -> values.addAll(Trait.findAll(traits, traitName))).walk(document);
        return List.copyOf(values);
    }

    public List<RangeWarning> validate(LiftDocument document, String rangesName) throws LiftParseException {
        List<RangeWarning> warnings = rangeValidator.validate(document, rangesService.loadRanges(rangesName));
        for (RangeWarning warning : warnings) {
            log.warn(warning.message());
        }
        return warnings;
    }
}
