package com.searchnexus.util;

import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.ProbeResult;

/**
 * Host-level control of engine processes. Commands return once issued; they
 * never wait for the process to settle.
 */
public interface ProcessSupervisor {

    void launch(NodeConfig node);

    void terminate(NodeConfig node);

    ProbeResult healthProbe(NodeConfig node);
}
