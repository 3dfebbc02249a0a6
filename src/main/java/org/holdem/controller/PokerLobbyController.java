package org.holdem.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.holdem.common.StateConflictException;
import org.holdem.dto.poker.*;
import org.holdem.model.poker.PlayerAction;
import org.holdem.service.HandHistoryService;
import org.holdem.service.PokerTableService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/api/poker")
@RequiredArgsConstructor
public class PokerLobbyController {

    private final PokerTableService service;
    private final HandHistoryService history;

    @GetMapping("/tables")
    public ResponseEntity<List<TableSummaryDTO>> list() {
        return ResponseEntity.ok(service.listTables());
    }

    @PostMapping("/table")
    public ResponseEntity<TableSummaryDTO> create(@Valid @RequestBody CreateTableRequest req, Principal principal) {
        String creator = principal != null ? principal.getName() : null;
        return ResponseEntity.ok(service.createTable(creator, req));
    }

    @DeleteMapping("/table/{id}")
    public ResponseEntity<?> close(@PathVariable Long id, Principal principal) {
        if (principal == null) return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Not authenticated"));
        service.closeTable(id, principal.getName()).join();
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /**
     * Public snapshot. With {@code version}, answers 409 and the fresh snapshot
     * when the table moved on.
     */
    @GetMapping("/table/{id}/snapshot")
    public ResponseEntity<TableSnapshot> snapshot(@PathVariable Long id, @RequestParam(required = false) Long version) {
        if (version == null) return ResponseEntity.ok(service.snapshot(id).join());
        try {
            return ResponseEntity.ok(service.snapshot(id, version).join());
        } catch (CompletionException e) {
            if (!(e.getCause() instanceof StateConflictException)) throw e;
            return ResponseEntity.status(HttpStatus.CONFLICT).body(service.snapshot(id).join());
        }
    }

    @GetMapping("/table/{id}/view")
    public ResponseEntity<PlayerView> view(@PathVariable Long id, Principal principal) {
        return ResponseEntity.ok(service.playerView(id, user(principal)).join());
    }

    @PostMapping("/table/{id}/sit")
    public ResponseEntity<Map<String, Object>> sit(@PathVariable Long id,
                                                   @RequestBody(required = false) SitMsg body,
                                                   Principal principal) {
        String name = body != null ? body.getDisplayName() : null;
        Long buyIn = body != null ? body.getBuyIn() : null;
        Integer seat = service.sit(id, user(principal), name, buyIn).join();
        return ResponseEntity.ok(Map.of("seat", seat));
    }

    @PostMapping("/table/{id}/leave")
    public ResponseEntity<Map<String, Object>> leave(@PathVariable Long id, Principal principal) {
        service.leave(id, user(principal)).join();
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/table/{id}/ai")
    public ResponseEntity<Map<String, Object>> addAi(@PathVariable Long id, @RequestBody(required = false) AiSeatRequest req) {
        String strategy = req != null ? req.getStrategy() : null;
        Long buyIn = req != null ? req.getBuyIn() : null;
        return ResponseEntity.ok(Map.of("playerId", service.addAiPlayer(id, strategy, buyIn).join()));
    }

    @PostMapping("/table/{id}/action")
    public ResponseEntity<Map<String, Object>> action(@PathVariable Long id, @Valid @RequestBody ActionMsg msg, Principal principal) {
        String player = user(principal);
        CompletableFuture<Long> f = service.submitAction(id, player, new PlayerAction(player, msg.getType(), msg.getAmount(), false));
        return ResponseEntity.ok(Map.of("version", f.join()));
    }

    @PostMapping("/table/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("started", service.startHand(id).join()));
    }

    @GetMapping("/table/{id}/hands")
    public ResponseEntity<List<HandHistoryService.HandRecord>> hands(@PathVariable Long id,
                                                                     @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(history.recentForTable(id, limit));
    }

    private String user(Principal principal) {
        if (principal == null) throw new IllegalStateException("Not authenticated");
        return principal.getName();
    }
}
