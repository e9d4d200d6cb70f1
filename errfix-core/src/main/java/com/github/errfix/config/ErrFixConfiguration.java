package com.github.errfix.config;

import com.github.errfix.ErrFix;
import lombok.Value;

import java.util.List;

/**
 * Settings of an errfix run.
 * <p>
 * Example .errfix.yaml:
 * <pre>
 * concurrency: 8     # files processed at the same time
 * exclude:           # directory names skipped when walking directories
 *   - vendor
 *   - testdata
 * </pre>
 */
@Value
public class ErrFixConfiguration {

    int concurrency;
    List<String> exclude;

    public static ErrFixConfiguration defaults() {
        return new ErrFixConfiguration(ErrFix.DEFAULT_CONCURRENCY, List.of());
    }

    public ErrFixConfiguration withConcurrency(int concurrency) {
        return new ErrFixConfiguration(concurrency, exclude);
    }
}
