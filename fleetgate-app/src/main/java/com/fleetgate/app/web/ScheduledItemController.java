package com.fleetgate.app.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.ScheduledItemRepository;
import com.fleetgate.store.model.ScheduledItem;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/scheduled-items")
public class ScheduledItemController {

    private final ScheduledItemRepository scheduledItems;
    private final AdminAuthorizer authorizer;

    public ScheduledItemController(ScheduledItemRepository scheduledItems, AdminAuthorizer authorizer) {
        this.scheduledItems = scheduledItems;
        this.authorizer = authorizer;
    }

    /**
     * Cancel a pending item. An item the ticker already claimed is not affected and fires once.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<ObjectNode> cancel(@PathVariable String id, HttpServletRequest request) {
        authorizer.authorize(request);
        ObjectNode body = JsonMapper.object();
        body.put("id", id);
        if (scheduledItems.markCancelled(id, System.currentTimeMillis() / 1000)) {
            log.info("Cancelled scheduled item {}", id);
            body.put("cancelled", true);
            return ResponseEntity.ok(body);
        }
        Optional<ScheduledItem> existing = scheduledItems.findById(id);
        if (existing.isEmpty()) {
            body.put("error", "Scheduled item not found");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        body.put("cancelled", false);
        body.put("status", existing.get().getStatus().dbValue());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
