package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.domain.HardwareSnapshot;

public interface HardwareSnapshotProvider {

    HardwareSnapshot snapshot();
}
