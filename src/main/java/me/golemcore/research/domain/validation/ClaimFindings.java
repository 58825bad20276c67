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

package me.golemcore.research.domain.validation;

import me.golemcore.research.domain.model.Citation;
import me.golemcore.research.domain.model.Confidence;
import me.golemcore.research.domain.model.Verdict;

import java.util.List;

/**
 * What one validation round reported about a claim. Labels the model omitted
 * are null.
 */
public record ClaimFindings(
        String claim,
        List<Citation> supporting,
        List<Citation> contradicting,
        Confidence confidence,
        Verdict verdict,
        String notes,
        Boolean needsMoreResearch) {

    public ClaimFindings {
        supporting = supporting == null ? List.of() : List.copyOf(supporting);
        contradicting = contradicting == null ? List.of() : List.copyOf(contradicting);
    }

    public static ClaimFindings empty() {
        return new ClaimFindings(null, List.of(), List.of(), null, null, null, null);
    }
}
