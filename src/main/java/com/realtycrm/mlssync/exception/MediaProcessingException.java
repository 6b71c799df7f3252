package com.realtycrm.mlssync.exception;

import com.realtycrm.mlssync.model.MediaStage;
import lombok.Getter;

import java.io.Serial;

/**
 * A single media item failed in one pipeline stage.
 */
@Getter
public class MediaProcessingException extends MlsSyncException {
    @Serial
    private static final long serialVersionUID = 3323108151637419180L;

    private final MediaStage stage;

    public MediaProcessingException(MediaStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public MediaProcessingException(MediaStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
