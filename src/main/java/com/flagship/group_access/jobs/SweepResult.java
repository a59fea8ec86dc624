package com.flagship.group_access.jobs;

import com.flagship.group_access.lifecycle.LifecycleTransition;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class SweepResult {

    Instant sweptAt;
    List<LifecycleTransition> transitions;
}
