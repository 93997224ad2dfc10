package dev.repodocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * RepoDocs relay: the dashboard-facing side of documentation generation.
 *
 * <p>Request flow:
 * <pre>
 * Dashboard → GenerateController → GenerationService → GenerationServiceClient (upstream open)
 *   → RelayTee (forward every chunk) → [owner only] TerminalFrameScanner → CompletionHandler
 *   → PersistenceGateway (upsert by slug) → synthesized "saved" frame → outbound close
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Forward first: every upstream chunk reaches the client before any other work on it</li>
 *   <li>Persistence only for authenticated owners, decided once when the relay is opened</li>
 *   <li>Persistence failures never reach the client except as a missing "saved" frame</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RepoDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoDocsApplication.class, args);
    }
}
