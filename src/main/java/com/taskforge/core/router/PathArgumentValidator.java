package com.taskforge.core.router;

import com.taskforge.core.capability.CapabilityRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Rejects path-like capability arguments that traverse upwards or point outside the allow-list.
 */
@Component
public class PathArgumentValidator {

    private final RouterProperties properties;

    public PathArgumentValidator(RouterProperties properties) {
        this.properties = properties;
    }

    public void validate(String capability, Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return;
        }
        for (String field : properties.getPathFields()) {
            Object value = args.get(field);
            if (!(value instanceof String path) || path.isBlank()) {
                continue;
            }
            if (path.contains("..")) {
                throw new CapabilityRejectedException(capability, "path_traversal",
                        "Path traversal detected in " + capability + "." + field);
            }
            if (isAbsolute(path) && !isAllowed(path)) {
                throw new CapabilityRejectedException(capability, "path_outside_allowlist",
                        "Path outside allowed directories in " + capability + "." + field + ": " + path);
            }
        }
    }

    private boolean isAllowed(String path) {
        List<String> prefixes = properties.getAllowedPathPrefixes();
        for (String prefix : prefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\") || path.matches("^[A-Za-z]:[\\\\/].*");
    }
}
