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

package me.golemcore.research.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * An atomic factual assertion under validation. Mutated only by successive
 * validation rounds on the same claim; final once confidence is HIGH or the
 * round budget is exhausted.
 */
@Data
@Builder
public class Claim {

    private String text;

    @Builder.Default
    private List<Citation> supportingEvidence = new ArrayList<>();

    @Builder.Default
    private List<Citation> contradictingEvidence = new ArrayList<>();

    @Builder.Default
    private Confidence confidence = Confidence.LOW;

    @Builder.Default
    private Verdict verdict = Verdict.UNCERTAIN;

    private boolean needsMoreResearch;

    private String notes;

    private int rounds;

    public static Claim of(String text) {
        return Claim.builder().text(text).build();
    }

    public void addSupporting(Citation citation) {
        if (!supportingEvidence.contains(citation)) {
            supportingEvidence.add(citation);
        }
    }

    public void addContradicting(Citation citation) {
        if (!contradictingEvidence.contains(citation)) {
            contradictingEvidence.add(citation);
        }
    }
}
