package com.purchasingpower.codegraph.util;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import org.slf4j.Logger;

import java.util.List;

/**
 * Unified logging for calls that leave the process (Neo4j, SCIP indexer, git).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (tool output, Cypher text).
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    public static String formatCommand(List<String> command) {
        return command == null ? "(none)" : String.join(" ", command);
    }
}
