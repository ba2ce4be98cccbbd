package com.purchasingpower.codegraph.configuration;

import com.purchasingpower.codegraph.extraction.StrategyType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SyncProperties {

    @NotNull
    private StrategyType defaultStrategy = StrategyType.NATIVE;

    /** Directory names pruned from the walk wherever they occur. */
    private List<String> excludedDirectories = new ArrayList<>(List.of(
            ".git", ".github", ".idea", ".vscode", ".gradle", ".mvn",
            "node_modules", "vendor", "target", "build", "bin", "dist", "out", "tmp"));

    private boolean includeTestSources = false;

    /** JavaParser language level name, e.g. JAVA_17. */
    @NotBlank
    private String languageLevel = "JAVA_17";
}
