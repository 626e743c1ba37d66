package fun.fengwk.afe.core.service.state;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Learning state persistence configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "afe.state")
public class StateProperties {

    /**
     * Restore learned state on startup and save it on shutdown.
     */
    private boolean persistenceEnabled = false;

    /**
     * Snapshot file path, supports {@code ~} for the user home.
     */
    private String snapshotPath = "~/.afe/learning-state.json";

}
