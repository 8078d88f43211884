package com.phillippitts.speakdict.service.health;

import com.phillippitts.speakdict.service.dictionary.compile.ActiveDictionarySlot;
import com.phillippitts.speakdict.service.dictionary.compile.UserDictCompilationPipeline;
import com.phillippitts.speakdict.service.dictionary.store.UserDictStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the user dictionary.
 *
 * <p>Reports:
 * <ul>
 *   <li>Where the store lives</li>
 *   <li>Whether the compiled dictionary exists and which one the analyzer is using</li>
 *   <li>Pipeline phase and the outcome of the last recompilation</li>
 * </ul>
 *
 * <p>DOWN only when the most recent recompilation failed. Exposed via /actuator/health endpoint.
 */
@Component
public class UserDictionaryHealthIndicator implements HealthIndicator {

    private final UserDictStore store;
    private final UserDictCompilationPipeline pipeline;
    private final ActiveDictionarySlot slot;

    public UserDictionaryHealthIndicator(UserDictStore store,
                                         UserDictCompilationPipeline pipeline,
                                         ActiveDictionarySlot slot) {
        this.store = store;
        this.pipeline = pipeline;
        this.slot = slot;
    }

    @Override
    public Health health() {
        Path compiled = pipeline.compiledPath();
        boolean compiledExists = Files.isRegularFile(compiled);

        Health.Builder builder = pipeline.lastFailure().isPresent() ? Health.down() : Health.up();
        builder.withDetail("store", store.location())
                .withDetail("compiledDictionary", compiledExists
                        ? "present at " + compiled
                        : "NOT FOUND at " + compiled)
                .withDetail("activeDictionary", slot.current().map(Path::toString).orElse("none"))
                .withDetail("state", pipeline.state().name());
        pipeline.lastSuccessAt().ifPresent(t -> builder.withDetail("lastSuccessAt", t.toString()));
        pipeline.lastFailure().ifPresent(msg -> builder.withDetail("lastFailure", msg));
        return builder.build();
    }
}
