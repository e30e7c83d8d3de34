package com.enms.analytics.controller;

import com.enms.analytics.event.ChannelGroup;
import com.enms.analytics.event.LiveChannelManager;
import com.enms.analytics.event.SseLiveSubscriber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/live")
@RequiredArgsConstructor
@Slf4j
public class LiveController {

    private final LiveChannelManager channelManager;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalConnections", channelManager.getConnectionCount());
        body.put("connectionsByGroup", channelManager.getConnectionsByGroup());
        return ResponseEntity.ok(body);
    }

    /**
     * Server-Sent Events stream of one channel group.
     */
    @GetMapping(value = "/{group}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable String group) {
        ChannelGroup channelGroup = ChannelGroup.fromWireName(group);
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        SseLiveSubscriber subscriber = new SseLiveSubscriber(emitter);

        emitter.onCompletion(() -> channelManager.unregister(channelGroup, subscriber.getId()));
        emitter.onTimeout(() -> channelManager.unregister(channelGroup, subscriber.getId()));
        emitter.onError(e -> channelManager.unregister(channelGroup, subscriber.getId()));

        channelManager.register(channelGroup, subscriber);
        return emitter;
    }
}
