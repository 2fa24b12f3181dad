package de.bsommerfeld.promptstore.core.host;

/**
 * The discovery step that produced a {@link HostRoot}, in the order the
 * steps are attempted.
 */
public enum DiscoveryStrategy {

    /** Root pinned by environment variable, taken as-is. */
    ENVIRONMENT_OVERRIDE,

    /** Container folder found walking up the install path as presented. */
    CONTAINER_SCAN,

    /** Container folder found after collapsing symlinks. */
    RESOLVED_CONTAINER_SCAN,

    /** Marker pair found walking up, container name ignored. */
    MARKER_SCAN,

    /** Working directory looks like a desktop-app install. */
    WORKING_DIRECTORY,

    /** Parent of a container folder that holds a {@code user} directory. */
    CONTAINER_PARENT
}
