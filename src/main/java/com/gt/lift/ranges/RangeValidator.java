package com.gt.lift.ranges;

import com.gt.lift.model.Entry;
import com.gt.lift.model.Example;
import com.gt.lift.model.GrammaticalInfo;
import com.gt.lift.model.LiftDocument;
import com.gt.lift.model.Pronunciation;
import com.gt.lift.model.Relation;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;
import com.gt.lift.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory check of entry values against a ranges registry. A value is only checked when the registry has the
 * range it belongs to, so a partial ranges document never produces noise for the ranges it leaves out.
 * Warnings never block parsing or generation.
 */
public class RangeValidator {

    private static final Logger log = LoggerFactory.getLogger(RangeValidator.class);

    public static final String GRAMMATICAL_INFO_RANGE = "grammatical-info";
    public static final String LEXICAL_RELATION_RANGE = "lexical-relation";

    public List<RangeWarning> validate(LiftDocument document, RangesRegistry registry) {
        List<RangeWarning> warnings = new ArrayList<>();
        for (Entry entry : document.entries()) {
            warnings.addAll(validate(entry, registry));
        }
        if (!warnings.isEmpty()) {
            log.info("{} range warnings in {} entries", warnings.size(), document.entries().size());
        }
        return warnings;
    }

    public List<RangeWarning> validate(Entry entry, RangesRegistry registry) {
        Checker checker = new Checker(entry.id(), registry);
        checker.grammaticalInfo("grammatical-info", entry.grammaticalInfo());
        checker.traits("", entry.traits());
        checker.relations("", entry.relations());
        for (int i = 0; i < entry.pronunciations().size(); i++) {
            checker.pronunciation("pronunciation[" + (i + 1) + "]/", entry.pronunciations().get(i));
        }
        for (int i = 0; i < entry.variants().size(); i++) {
            Variant variant = entry.variants().get(i);
            String location = "variant[" + (i + 1) + "]/";
            checker.traits(location, variant.traits());
            checker.grammaticalInfo(location + "grammatical-info", variant.grammaticalInfo());
            checker.relations(location, variant.relations());
            for (Pronunciation pronunciation : variant.pronunciations()) {
                checker.pronunciation(location + "pronunciation/", pronunciation);
            }
        }
        for (int i = 0; i < entry.senses().size(); i++) {
            checker.sense("", "sense", i, entry.senses().get(i));
        }
        return checker.warnings;
    }

    private static class Checker {
        private final String entryId;
        private final RangesRegistry registry;
        private final List<RangeWarning> warnings = new ArrayList<>();

        Checker(String entryId, RangesRegistry registry) {
            this.entryId = entryId;
            this.registry = registry;
        }

        void sense(String prefix, String name, int index, Sense sense) {
            String location = prefix + name + (sense.id() != null ? "[" + sense.id() + "]" : "[" + (index + 1) + "]") + "/";
            grammaticalInfo(location + "grammatical-info", sense.grammaticalInfo());
            traits(location, sense.traits());
            relations(location, sense.relations());
            for (int i = 0; i < sense.examples().size(); i++) {
                Example example = sense.examples().get(i);
                traits(location + "example[" + (i + 1) + "]/", example.traits());
            }
            for (int i = 0; i < sense.subsenses().size(); i++) {
                sense(location, "subsense", i, sense.subsenses().get(i));
            }
        }

        void pronunciation(String location, Pronunciation pronunciation) {
            traits(location, pronunciation.traits());
        }

        void grammaticalInfo(String location, GrammaticalInfo grammaticalInfo) {
            if (grammaticalInfo != null) {
                check(location, GRAMMATICAL_INFO_RANGE, grammaticalInfo.value());
                traits(location + "/", grammaticalInfo.traits());
            }
        }

        void traits(String location, List<Trait> traits) {
            for (Trait trait : traits) {
                check(location + "trait[" + trait.name() + "]", trait.name(), trait.value());
            }
        }

        // Private relation types are tool specific and never listed in lexical-relation
        void relations(String location, List<Relation> relations) {
            for (Relation relation : relations) {
                String relationLocation = location + "relation[" + relation.type() + "]";
                if (!relation.isPrivateType()) {
                    check(relationLocation, LEXICAL_RELATION_RANGE, relation.type());
                }
                traits(relationLocation + "/", relation.traits());
            }
        }

        private void check(String location, String rangeId, String value) {
            if (value == null || !registry.hasRange(rangeId) || registry.contains(rangeId, value)) {
                return;
            }
            warnings.add(new RangeWarning(entryId, location, rangeId, value));
        }
    }
}
