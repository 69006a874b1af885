package com.guildshortcuts.controller;

import com.guildshortcuts.model.dto.DispatchReply;
import com.guildshortcuts.model.dto.InboundMessage;
import com.guildshortcuts.service.PrefixDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final PrefixDispatcher prefixDispatcher;

    @PostMapping
    public ResponseEntity<DispatchReply> onMessage(@Valid @RequestBody InboundMessage message) {
        return prefixDispatcher.dispatch(message)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
