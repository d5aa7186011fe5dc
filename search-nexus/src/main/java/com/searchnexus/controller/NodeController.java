package com.searchnexus.controller;

import com.searchnexus.dto.ClusterChangeRequest;
import com.searchnexus.dto.CopyRequest;
import com.searchnexus.dto.MoveRequest;
import com.searchnexus.dto.NodeConfigRequest;
import com.searchnexus.dto.ValidateRequest;
import com.searchnexus.model.CopyResult;
import com.searchnexus.model.DeleteResult;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.MoveResult;
import com.searchnexus.model.NodeStatus;
import com.searchnexus.model.RepairReport;
import com.searchnexus.model.ValidationResult;
import com.searchnexus.service.NodeOrchestrator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/nodes")
public class NodeController {

    static final String SESSION_HEADER = "X-Nexus-Session";

    @Autowired
    private NodeOrchestrator orchestrator;

    @GetMapping
    public List<NodeStatus> getAllNodes(@RequestParam(defaultValue = "false") boolean refresh) {
        return orchestrator.listNodes(refresh);
    }

    @GetMapping("/{name}")
    public NodeStatus getNode(@PathVariable String name) {
        return orchestrator.getNode(name);
    }

    @GetMapping(value = "/{name}/config", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getNodeConfig(@PathVariable String name) {
        return orchestrator.readConfig(name);
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody ValidateRequest request) {
        ValidationResult result = orchestrator.validate(request.getNodeConfig(), request.getOriginalName());
        return ResponseEntity.status(result.isValid() ? HttpStatus.OK : HttpStatus.CONFLICT).body(result);
    }

    @PostMapping
    public ResponseEntity<NodeStatus> createNode(@RequestBody NodeConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orchestrator.create(request));
    }

    @PutMapping("/{name}")
    public NodeStatus updateNode(@PathVariable String name, @RequestBody NodeConfigRequest request) {
        return orchestrator.update(name, request);
    }

    @PutMapping("/{name}/cluster")
    public NodeStatus changeCluster(@PathVariable String name, @RequestBody ClusterChangeRequest request) {
        return orchestrator.changeCluster(name, request.getCluster());
    }

    @PostMapping("/{name}/move")
    public MoveResult moveNode(@PathVariable String name, @RequestBody MoveRequest request) {
        return orchestrator.move(name, request);
    }

    @PostMapping("/{name}/copy")
    public ResponseEntity<CopyResult> copyNode(@PathVariable String name, @RequestBody CopyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orchestrator.copy(name, request));
    }

    @PostMapping("/{name}/start")
    public ResponseEntity<LifecycleTask> startNode(@PathVariable String name,
                                                   @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return ResponseEntity.accepted().body(orchestrator.start(name, sessionId));
    }

    @PostMapping("/{name}/stop")
    public ResponseEntity<LifecycleTask> stopNode(@PathVariable String name,
                                                  @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return ResponseEntity.accepted().body(orchestrator.stop(name, sessionId));
    }

    @DeleteMapping("/{name}")
    public DeleteResult removeNode(@PathVariable String name,
                                   @RequestParam(defaultValue = "false") boolean preserveData) {
        return orchestrator.delete(name, preserveData);
    }

    @PostMapping("/repair-and-verify")
    public RepairReport repairAndVerify() {
        return orchestrator.repairAndVerify();
    }
}
