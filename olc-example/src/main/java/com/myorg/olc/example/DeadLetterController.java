package com.myorg.olc.example;

import com.myorg.olc.queue.DurableQueue;
import com.myorg.olc.queue.QueueMessage;
import com.myorg.olc.queue.QueueRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of queues for operators. Dead-lettered messages are inspected here, never replayed.
 */
@RestController
@RequestMapping("/queues")
@RequiredArgsConstructor
public class DeadLetterController {

    private final QueueRegistry queues;

    @GetMapping
    public Map<String, Integer> sizes() {
        Map<String, Integer> out = new TreeMap<>();
        for (DurableQueue q : queues.all()) {
            out.put(q.name(), q.size());
        }
        return out;
    }

    @GetMapping("/{name}/messages")
    public List<QueueMessage> peek(@PathVariable String name, @RequestParam(defaultValue = "10") int max) {
        DurableQueue q = queues.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no queue " + name));
        return q.peek(Math.max(1, Math.min(max, 100)));
    }
}
