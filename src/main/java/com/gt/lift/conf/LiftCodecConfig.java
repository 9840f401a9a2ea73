package com.gt.lift.conf;

import com.gt.lift.document.IdentifierGenerator;
import com.gt.lift.document.ShortUuidIdentifierGenerator;
import com.gt.lift.generator.LiftGenerator;
import com.gt.lift.parser.LiftParser;
import com.gt.lift.parser.ParseMode;
import com.gt.lift.parser.PreservationMode;
import com.gt.lift.ranges.LiftRangesGenerator;
import com.gt.lift.ranges.LiftRangesParser;
import com.gt.lift.ranges.RangeValidator;
import com.gt.lift.store.LiftStore;
import com.gt.lift.store.impl.FileSystemLiftStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class LiftCodecConfig {

    @Bean
    public LiftParser getLiftParser(@Value("${lift.parser.mode:STRICT}") ParseMode parseMode,
                                    @Value("${lift.parser.preservation:KNOWN_SUBSET}") PreservationMode preservationMode,
                                    @Value("${lift.parser.max-sense-depth:8}") int maxSenseDepth) {
        return new LiftParser(parseMode, preservationMode, maxSenseDepth);
    }

    @Bean
    public LiftGenerator getLiftGenerator(@Value("${lift.generator.producer}") String producer,
                                          @Value("${lift.generator.pretty-print:true}") boolean prettyPrint) {
        return new LiftGenerator(producer, prettyPrint);
    }

    @Bean
    public LiftRangesParser getLiftRangesParser(@Value("${lift.parser.mode:STRICT}") ParseMode parseMode) {
        return new LiftRangesParser(parseMode);
    }

    @Bean
    public LiftRangesGenerator getLiftRangesGenerator(@Value("${lift.generator.pretty-print:true}") boolean prettyPrint) {
        return new LiftRangesGenerator(prettyPrint);
    }

    @Bean
    public RangeValidator getRangeValidator() {
        return new RangeValidator();
    }

    @Bean
    public LiftStore getLiftStore(@Value("${lift.store.directory}") String directory) {
        return new FileSystemLiftStore(Path.of(directory));
    }

    @Bean
    public IdentifierGenerator getIdentifierGenerator() {
        return new ShortUuidIdentifierGenerator();
    }
}
