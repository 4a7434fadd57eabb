package com.example.punchsync.client;

import com.example.punchsync.model.DeviceConfig;
import com.example.punchsync.util.CancellationToken;

/**
 * Entry point to a vendor protocol. Implementations must bound the time spent in
 * {@link #connect(DeviceConfig, CancellationToken)}: a terminal that never answers may not
 * hang the calling worker.
 */
public interface DeviceDriver {
    DeviceSession connect(DeviceConfig device, CancellationToken cancellation) throws DeviceException;
}
