package com.example.procloner.controller;

import com.example.procloner.model.CloneRequest;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.SessionView;
import com.example.procloner.service.CloneSessionManager;
import com.example.procloner.service.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CloneController {

    private static final Logger log = LoggerFactory.getLogger(CloneController.class);

    private final CloneSessionManager manager;
    private final SessionStore store;

    public CloneController(CloneSessionManager manager, SessionStore store) {
        this.manager = manager;
        this.store = store;
    }

    // url is already validated upstream; only emptiness is checked here
    @PostMapping("/clone")
    public ResponseEntity<Map<String, Object>> startClone(@RequestBody CloneRequest request) {
        if (request == null || request.getUrl() == null || request.getUrl().trim().isEmpty()) {
            throw new IllegalArgumentException("url must not be empty");
        }
        request.setUrl(request.getUrl().trim());
        log.info("[SESSION] clone requested for {} depth={} include={}", request.getUrl(),
                request.getOptions().getDepth(), request.getOptions().getIncludeAssets());
        CloneSession session = manager.start(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", session.getId());
        body.put("status", session.getStatus().value());
        body.put("message", "Cloning started");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/session/{id}")
    public SessionView getSession(@PathVariable("id") String id) {
        CloneSession session = store.require(id);
        return SessionView.of(session, store.canRecover(session));
    }

    @GetMapping("/session/{id}/assets")
    public List<DiscoveredAsset> getAssets(@PathVariable("id") String id) {
        CloneSession session = store.require(id);
        if (session.getCrawlState() == null) return Collections.emptyList();
        return session.getCrawlState().assetsInDiscoveryOrder();
    }

    @GetMapping("/session/{id}/result")
    public ResponseEntity<Object> getResult(@PathVariable("id") String id) {
        CloneSession session = store.require(id);
        CloningResult result = session.getResult();
        if (!session.getStatus().isTerminal() || result == null) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("sessionId", id);
            body.put("status", session.getStatus().value());
            body.put("message", "Session has not finished");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/sessions")
    public List<SessionView> listSessions() {
        List<SessionView> views = new ArrayList<>();
        for (CloneSession s : store.list()) {
            views.add(SessionView.of(s, store.canRecover(s)));
        }
        Collections.sort(views, new Comparator<SessionView>() {
            public int compare(SessionView a, SessionView b) {
                return b.getStartTime().compareTo(a.getStartTime());
            }
        });
        return views;
    }

    @DeleteMapping("/session/{id}")
    public ResponseEntity<Void> deleteSession(@PathVariable("id") String id) {
        manager.remove(id);
        return ResponseEntity.noContent().build();
    }
}
