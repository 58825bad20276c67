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

package me.golemcore.research.adapter.inbound.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.ResearchMode;
import me.golemcore.research.domain.model.ResearchRequest;
import me.golemcore.research.domain.model.ResearchResult;
import me.golemcore.research.domain.service.ResearchService;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a single research query at startup when {@code research.cli.query} is
 * set. With {@code research.cli.compare-direct} the tool-less baseline answer
 * is produced and persisted next to the researched one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchCommandLineRunner implements ApplicationRunner {

    private final ResearchService researchService;
    private final ResearchProperties properties;
    private final ApplicationContext applicationContext;

    @Override
    public void run(ApplicationArguments args) {
        ResearchProperties.CliProperties cli = properties.getCli();
        if (cli.getQuery() == null || cli.getQuery().isBlank()) {
            return;
        }

        List<ResearchResult> results = runQuery(cli);
        for (ResearchResult result : results) {
            log.info("[CLI] {} ({}): stopReason={}, steps={}, saved={}\n{}", result.getMode().getReportTitle(),
                    result.getMode().fileStem(), result.getStopReason(), result.getSteps(),
                    result.getReportPath(), result.getReport().body());
        }

        if (cli.isExitOnCompletion()) {
            exit(SpringApplication.exit(applicationContext, () -> 0));
        }
    }

    List<ResearchResult> runQuery(ResearchProperties.CliProperties cli) {
        ResearchMode mode = ResearchMode.fromString(cli.getMode());
        List<ResearchResult> results = new ArrayList<>();
        results.add(researchService.research(ResearchRequest.builder()
                .query(cli.getQuery())
                .mode(mode)
                .build()));
        if (cli.isCompareDirect() && mode != ResearchMode.DIRECT) {
            results.add(researchService.research(ResearchRequest.builder()
                    .query(cli.getQuery())
                    .mode(ResearchMode.DIRECT)
                    .build()));
        }
        return results;
    }

    protected void exit(int exitCode) {
        Thread exitThread = new Thread(() -> System.exit(exitCode), "research-cli-exit");
        exitThread.setDaemon(false);
        exitThread.start();
    }
}
