package com.questrail.chat.protocol.observability;

import com.questrail.chat.api.SessionOutput;
import com.questrail.chat.protocol.model.TerminationCause;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionOutput} that writes user-visible effects to SLF4J.
 *
 * <p>Used by the runtime when no output is supplied.</p>
 */
public final class Slf4jSessionOutput implements SessionOutput {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSessionOutput.class);

    @Override
    public void onChatMessage(String sender, String content) {
        log.info("{}: {}", sender, content);
    }

    @Override
    public void onReply(boolean success, String content) {
        if (success) {
            log.info("Action Success: {}", content);
        } else {
            log.info("Action Failure: {}", content);
        }
    }

    @Override
    public void onRemoteError(String sender, String content) {
        log.error("ERROR FROM {}: {}", sender, content);
    }

    @Override
    public void onLocalError(String description) {
        log.error("ERROR: {}", description);
    }

    @Override
    public void onTerminated(TerminationCause cause) {
        log.info("Session terminated ({})", cause);
    }
}
