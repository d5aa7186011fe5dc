package com.searchnexus.controller;

import com.searchnexus.dto.ClusterRenameRequest;
import com.searchnexus.model.ClusterStatus;
import com.searchnexus.service.ClusterService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/clusters")
public class ClusterController {

    @Autowired
    private ClusterService clusterService;

    @GetMapping
    public List<ClusterStatus> getAllClusters() {
        return clusterService.listClusters();
    }

    @GetMapping("/{name}")
    public ClusterStatus getCluster(@PathVariable String name) {
        return clusterService.getCluster(name);
    }

    @PutMapping("/{name}")
    public ClusterStatus renameCluster(@PathVariable String name, @RequestBody ClusterRenameRequest request) {
        return clusterService.renameCluster(name, request.getNewName());
    }

    @DeleteMapping("/{name}")
    public Map<String, Object> deleteCluster(@PathVariable String name,
                                             @RequestParam(required = false) String targetCluster) {
        return clusterService.deleteCluster(name, targetCluster);
    }
}
