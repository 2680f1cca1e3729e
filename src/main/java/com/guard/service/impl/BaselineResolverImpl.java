package com.guard.service.impl;

import com.guard.model.ApiSpecification;
import com.guard.model.SpecPair;
import com.guard.service.api.BaselineResolver;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves baseline and candidate by declared version: the lower semantic version is the baseline.
 * <p>
 * When both documents declare the same version, the one whose normalized absolute file path sorts
 * first lexically becomes the baseline. Either way the outcome only depends on the two documents,
 * never on which one was passed first.
 */
@Service
@Slf4j
public class BaselineResolverImpl implements BaselineResolver {

    @Override
    public SpecPair resolve(ApiSpecification first, ApiSpecification second) {
        int byVersion = first.semanticVersion().compareTo(second.semanticVersion());
        boolean firstIsBaseline;
        if (byVersion != 0) {
            firstIsBaseline = byVersion < 0;
        } else {
            int byPath = normalized(first.source()).compareTo(normalized(second.source()));
            if (byPath == 0) {
                byPath = first.source().compareTo(second.source());
            }
            firstIsBaseline = byPath <= 0;
            log.debug("Both documents declare version {}; ordering by file path", first.version());
        }
        SpecPair pair = firstIsBaseline ? new SpecPair(first, second) : new SpecPair(second, first);
        log.info("Baseline: {} ({}), candidate: {} ({})",
                pair.baseline().source(), pair.baseline().version(),
                pair.candidate().source(), pair.candidate().version());
        return pair;
    }

    private static String normalized(String source) {
        return Paths.get(source).toAbsolutePath().normalize().toString();
    }
}
