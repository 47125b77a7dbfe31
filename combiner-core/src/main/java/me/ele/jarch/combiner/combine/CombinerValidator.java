package me.ele.jarch.combiner.combine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a combined statement completed on every node.
 * A false result with no error seen means a node's reply went missing; the caller must report
 * the statement as failed.
 */
public class CombinerValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CombinerValidator.class);

    private CombinerValidator() {
    }

    public static boolean validate(ResponseCombiner combiner) {
        String failure = findFailure(combiner);
        if (failure == null) {
            return true;
        }
        // an error already reached the client, nothing more to report
        if (!combiner.isInErrorState()) {
            LOGGER.warn("combiner validation failed: {}, {}", failure, combiner);
        }
        return false;
    }

    /**
     * @return why the combiner is not complete, null if it is
     */
    static String findFailure(ResponseCombiner combiner) {
        // There was error message while combining
        if (combiner.isInErrorState()) {
            return "error response received";
        }
        int nodeCount = combiner.getNodeCount();
        switch (combiner.getRequestType()) {
            case NOT_DEFINED:
                return "no response classified";
            case COMMAND:
                return checkCount("CommandComplete", combiner.getCommandCompleteCount(),
                    nodeCount);
            case QUERY:
                String failure = checkCount("CommandComplete", combiner.getCommandCompleteCount(),
                    nodeCount);
                return failure != null ?
                    failure :
                    checkCount("description", combiner.getDescriptionCount(), nodeCount);
            case COPY_IN:
                return checkCount("CopyInResponse", combiner.getCopyInCount(), nodeCount);
            case COPY_OUT:
                return checkCount("copy out", combiner.getCopyOutCount(), nodeCount);
            default:
                return "unknown request type " + combiner.getRequestType();
        }
    }

    private static String checkCount(String phase, int count, int nodeCount) {
        if (count == nodeCount) {
            return null;
        }
        return String.format("%s count %d of %d nodes", phase, count, nodeCount);
    }
}
