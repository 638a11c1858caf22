/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
 */

package ai.floedb.tracestats.analysis;

import java.time.Instant;

/** Bounds on a block's start time; a null bound is open. */
public record StartTimeWindow(Instant notBefore, Instant notAfter) {

  private static final StartTimeWindow UNBOUNDED = new StartTimeWindow(null, null);

  public static StartTimeWindow unbounded() {
    return UNBOUNDED;
  }

  public boolean contains(Instant startTime) {
    if (notAfter != null && startTime.isAfter(notAfter)) {
      return false;
    }
    return notBefore == null || !startTime.isBefore(notBefore);
  }
}
