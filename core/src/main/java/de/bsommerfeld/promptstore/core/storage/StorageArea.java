package de.bsommerfeld.promptstore.core.storage;

/**
 * Standard subdirectories of the data directory.
 */
public enum StorageArea {

    BACKUPS("backups"),
    EXPORTS("exports"),
    LOGS("logs"),
    CACHE("cache");

    private final String directoryName;

    StorageArea(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }
}
