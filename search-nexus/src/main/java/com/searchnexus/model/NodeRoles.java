package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeRoles {
    private boolean master = true;
    private boolean data = true;
    private boolean ingest = true;

    public static NodeRoles all() {
        return new NodeRoles(true, true, true);
    }

    public boolean anyEnabled() {
        return master || data || ingest;
    }

    public List<String> names() {
        List<String> roles = new ArrayList<>();
        if (master) roles.add("master");
        if (data) roles.add("data");
        if (ingest) roles.add("ingest");
        return roles;
    }

    public NodeRoles copy() {
        return new NodeRoles(master, data, ingest);
    }
}
