/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.pipeline.exec;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProgressListener} writing progress to the log: steps at debug level, completion at info level.
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void report(int current, int total, String label) {
        if (log.isDebugEnabled()) {
            int percent = total == 0 ? 100 : (int) (100L * current / total);
            log.debug("{} {}/{} ({}%)", label, current, total, percent);
        }
    }

    @Override
    public void done(String label) {
        log.info("{} [DONE]", label);
    }
}
