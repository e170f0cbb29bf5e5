package com.mouse.provisioner.service;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.PageState;
import com.mouse.provisioner.exception.BrowserSessionException;
import com.mouse.provisioner.interfaces.BrowserEngine;
import com.mouse.provisioner.interfaces.BrowserSession;
import com.mouse.provisioner.model.Proxy;
import com.mouse.provisioner.model.SessionArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reopens stored accounts from their session artifact and marks the ones that no longer
 * land on an authenticated page as FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountSessionVerifier {

    private final BrowserEngine browserEngine;
    private final AccountStore accountStore;

    /**
     * @param knownProxies proxies with credentials, matched to stored labels; an account whose
     *                     proxy is not among them is left untouched rather than opened directly
     * @return emails marked failed by this pass
     */
    public List<String> verifyActive(Collection<Proxy> knownProxies) {
        Map<String, Proxy> byLabel = knownProxies.stream()
                .collect(Collectors.toMap(Proxy::label, Function.identity(), (a, b) -> a));

        List<String> failed = new ArrayList<>();
        List<Account> accounts = accountStore.active();
        for (Account account : accounts) {
            Proxy proxy = byLabel.get(account.getProxy());
            if (proxy == null) {
                log.warn("Proxy not in list, skipping | Email: {} | Proxy: {}", account.getEmail(), account.getProxy());
                continue;
            }
            Boolean valid = check(account, proxy);
            if (Boolean.FALSE.equals(valid) && accountStore.markFailed(account.getEmail())) {
                failed.add(account.getEmail());
            }
        }
        log.info("Session verification done | Checked: {} | Failed: {}", accounts.size(), failed.size());
        return failed;
    }

    /**
     * @return null when the check could not run because of browser or proxy trouble
     */
    Boolean check(Account account, Proxy proxy) {
        SessionArtifact artifact = new SessionArtifact(account.getSessionArtifact());
        if (artifact.isEmpty()) {
            log.warn("No session artifact | Email: {}", account.getEmail());
            return false;
        }
        try (BrowserSession session = browserEngine.restore(artifact, proxy)) {
            PageState state = browserEngine.readState(session);
            log.debug("Session state | Email: {} | State: {}", account.getEmail(), state);
            return state == PageState.AUTHENTICATED;
        } catch (BrowserSessionException e) {
            log.warn("Could not verify session | Email: {} | Proxy: {} | Error: {}",
                    account.getEmail(), account.getProxy(), e.getMessage());
            return null;
        }
    }
}
