package me.golemcore.jira.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StepOutcome {

    private StepStatus status;
    private TrackerError error;

    public static StepOutcome skipped() {
        return StepOutcome.builder().status(StepStatus.SKIPPED).build();
    }

    public static StepOutcome succeeded() {
        return StepOutcome.builder().status(StepStatus.SUCCEEDED).build();
    }

    public static StepOutcome failed(TrackerError error) {
        return StepOutcome.builder().status(StepStatus.FAILED).error(error).build();
    }

    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }
}
