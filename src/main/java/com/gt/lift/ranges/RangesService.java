package com.gt.lift.ranges;

import com.gt.lift.conf.CachingConfig;
import com.gt.lift.exception.LiftParseException;
import com.gt.lift.parser.ParseIssue;
import com.gt.lift.store.LiftStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

@Component
public class RangesService {

    private static final Logger log = LoggerFactory.getLogger(RangesService.class);

    private final LiftStore liftStore;
    private final LiftRangesParser liftRangesParser;
    private final LiftRangesGenerator liftRangesGenerator;

    @Autowired
    public RangesService(LiftStore liftStore, LiftRangesParser liftRangesParser, LiftRangesGenerator liftRangesGenerator) {
        this.liftStore = liftStore;
        this.liftRangesParser = liftRangesParser;
        this.liftRangesGenerator = liftRangesGenerator;
    }

    // Registries are immutable, so one cached instance is shared by every caller until the next eviction
    @Cacheable(CachingConfig.RANGES)
    public RangesRegistry loadRanges(String name) throws LiftParseException {
        log.info("Loading LIFT ranges from {}", name);

        RangesParseResult result = liftRangesParser.parse(liftStore.read(name));
        for (ParseIssue issue : result.issues()) {
            log.warn("{} in {} at {}: {}", issue.type(), name, issue.path(), issue.message());
        }
        return result.registry();
    }

    @CacheEvict(value = CachingConfig.RANGES, key = "#name")
    public void saveRanges(String name, RangesRegistry registry) {
        liftStore.write(name, liftRangesGenerator.generateBytes(registry));
        log.info("Saved {} LIFT ranges to {}", registry.rangeIds().size(), name);
    }
}
