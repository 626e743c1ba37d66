package fun.fengwk.afe.core.service.state;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Restores learned state on startup and saves it on shutdown when persistence is enabled.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LearningStateBootstrap implements ApplicationRunner {

    private final StateProperties stateProperties;
    private final LearningStateService learningStateService;
    private final LearningStateFileStore learningStateFileStore;

    @Override
    public void run(ApplicationArguments args) {
        if (!stateProperties.isPersistenceEnabled()) {
            return;
        }
        try {
            learningStateFileStore.load().ifPresent(learningStateService::restoreState);
        } catch (IllegalStateException | IllegalArgumentException ex) {
            log.warn("restore learning state failed, path={}, error={}",
                learningStateFileStore.getSnapshotPath(), ex.getMessage());
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (!stateProperties.isPersistenceEnabled()) {
            return;
        }
        try {
            learningStateFileStore.save(learningStateService.exportState());
        } catch (IllegalStateException ex) {
            log.warn("save learning state failed, path={}, error={}",
                learningStateFileStore.getSnapshotPath(), ex.getMessage());
        }
    }

}
