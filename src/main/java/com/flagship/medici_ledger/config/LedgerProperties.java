package com.flagship.medici_ledger.config;

import jakarta.validation.constraints.NotBlank;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Settings under the {@code ledger} prefix.
 *
 * Import and export paths are optional; a batch step runs only when its path is set.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @NotBlank
    private String name = "Medici Family Bank";

    private final Runner runner = new Runner();

    @Getter(AccessLevel.NONE)
    private final Import importing = new Import();

    private final Export export = new Export();

    private final Reports reports = new Reports();

    // "import" is a keyword, so bind it through an explicit accessor
    public Import getImport() {
        return importing;
    }

    @Getter
    @Setter
    public static class Runner {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Import {
        private Path csv;
        private Path json;
        private boolean verbose;
    }

    @Getter
    @Setter
    public static class Export {
        private Path csv;
        private Path json;
    }

    @Getter
    @Setter
    public static class Reports {
        private boolean print = true;
    }
}
