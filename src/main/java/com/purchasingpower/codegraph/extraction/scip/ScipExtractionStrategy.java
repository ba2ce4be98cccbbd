package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.ExternalToolException;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ExtractionStrategy;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.StrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * External-tool strategy: runs a SCIP indexer over the whole project once per
 * run, then projects the decoded index onto the entity model file by file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScipExtractionStrategy implements ExtractionStrategy {

    private final ScipToolRunner toolRunner;
    private final ScipIndexReader indexReader;
    private final CodeGraphProperties properties;

    @Override
    public StrategyType type() {
        return StrategyType.SCIP;
    }

    @Override
    public ExtractionSession open(ProjectScope scope) {
        Path artifact = toolRunner.run(scope.getProjectRoot());
        ScipIndex index;
        try {
            index = indexReader.read(artifact);
        } catch (ExternalToolException e) {
            ScipSession.deleteArtifact(artifact);
            throw e;
        }
        log.info("🧭 SCIP index ready for {}: {} documents ({} {}, root {})", scope.getServiceName(),
                index.getDocuments().size(), index.getToolName(), index.getToolVersion(), index.getProjectRoot());
        return new ScipSession(index, artifact, properties.getScip().isKeepArtifact());
    }
}
