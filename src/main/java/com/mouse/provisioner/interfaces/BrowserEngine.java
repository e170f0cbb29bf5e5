package com.mouse.provisioner.interfaces;

import com.mouse.provisioner.enums.FormStep;
import com.mouse.provisioner.enums.PageState;
import com.mouse.provisioner.model.Proxy;
import com.mouse.provisioner.model.SessionArtifact;
import com.mouse.provisioner.model.SubmitOutcome;

import java.util.Map;

/**
 * Browser automation used by the signup flow and by session reuse.
 * Every method may throw {@link com.mouse.provisioner.exception.BrowserSessionException}
 * on network or proxy trouble.
 */
public interface BrowserEngine {

    BrowserSession open(Proxy proxy);

    /** Opens a session preloaded with a previously captured artifact. */
    BrowserSession restore(SessionArtifact artifact, Proxy proxy);

    SubmitOutcome submit(BrowserSession session, FormStep step, Map<String, String> fields);

    PageState readState(BrowserSession session);

    SessionArtifact capture(BrowserSession session);
}
