package org.holdem.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.ActionRejectedException;
import org.holdem.common.StateConflictException;
import org.holdem.common.TableFullException;
import org.holdem.dto.poker.*;
import org.holdem.model.poker.PlayerAction;
import org.holdem.service.PokerTableService;
import org.holdem.service.poker.sync.BroadcastService;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.concurrent.CompletionException;

/**
 * STOMP side. Replies never block the inbound channel: results and errors go
 * back to the caller's user queues when the table's worker is done.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class PokerWsController {

    private final PokerTableService service;
    private final BroadcastService broadcast;

    @MessageMapping("/poker/action")
    public void action(@Valid @Payload ActionMsg msg, Principal principal) {
        String player = requireUser(principal);
        PlayerAction action = new PlayerAction(player, msg.getType(), msg.getAmount(), false);
        service.submitAction(msg.getTableId(), player, action)
                .whenComplete((version, ex) -> { if (ex != null) reportError(player, msg.getTableId(), ex); });
    }

    @MessageMapping("/poker/sit")
    public void sit(@Valid @Payload SitMsg msg, Principal principal) {
        String player = requireUser(principal);
        service.sit(msg.getTableId(), player, msg.getDisplayName(), msg.getBuyIn())
                .whenComplete((seat, ex) -> { if (ex != null) reportError(player, msg.getTableId(), ex); });
    }

    @MessageMapping("/poker/leave")
    public void leave(@Payload SitMsg msg, Principal principal) {
        String player = requireUser(principal);
        service.leave(msg.getTableId(), player)
                .whenComplete((v, ex) -> { if (ex != null) reportError(player, msg.getTableId(), ex); });
    }

    /** Sends the caller a full private view, answering a client that lost track of versions. */
    @MessageMapping("/poker/resync")
    public void resync(@Payload ResyncMsg msg, Principal principal) {
        String player = requireUser(principal);
        if (msg.getKnownVersion() != null) {
            log.debug("table={} {} resync from v{}", msg.getTableId(), player, msg.getKnownVersion());
        }
        service.playerView(msg.getTableId(), player)
                .whenComplete((view, ex) -> {
                    if (ex != null) reportError(player, msg.getTableId(), ex);
                    else broadcast.sendPrivate(player, msg.getTableId(), view);
                });
    }

    void reportError(String player, Long tableId, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String reason;
        if (cause instanceof ActionRejectedException r) reason = r.getReason().name();
        else if (cause instanceof StateConflictException) reason = "STATE_CONFLICT";
        else if (cause instanceof TableFullException) reason = "TABLE_FULL";
        else if (cause instanceof IllegalArgumentException || cause instanceof IllegalStateException) reason = "REFUSED";
        else {
            log.error("table={} unexpected failure for {}", tableId, player, cause);
            reason = "ERROR";
        }
        broadcast.sendError(player, PokerError.builder()
                .tableId(tableId)
                .reason(reason)
                .error(cause.getMessage())
                .build());
    }

    private String requireUser(Principal principal) {
        if (principal == null || principal.getName() == null) {
            throw new IllegalStateException("Unauthenticated socket");
        }
        return principal.getName();
    }
}
