package com.realtycrm.mlssync.model;

/**
 * The media pipeline step in which a failure occurred.
 */
public enum MediaStage {
    DOWNLOAD,
    VALIDATE,
    PROCESS,
    UPLOAD
}
