package in.annupaper.marketfeed.service.broadcast;

import java.util.Map;

/**
 * Answer to "can the legacy delivery path be removed now".
 *
 * @param reason first failing check, or a confirmation when ready
 * @param checks every check by name with its result
 */
public record LegacyRemovalReadiness(boolean ready, String reason, Map<String, Boolean> checks) {}
