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

package ai.floedb.tracestats.analysis.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class AttrStatsPoolTest {

  @Test
  void reusedStatsCarryNoState() {
    AttrStatsPool pool = new AttrStatsPool();
    AttrStats s = pool.acquire();
    s.name("tags");
    s.addValue("x", 1);
    s.markArray();
    s.markNull();
    pool.release(s);

    AttrStats again = pool.acquire();
    assertSame(s, again);
    assertEquals("", again.name());
    assertEquals("", again.value());
    assertEquals(0, again.bytes());
    assertFalse(again.isArray());
    assertFalse(again.isNull());
  }

  @Test
  void idleListIsBounded() {
    AttrStatsPool pool = new AttrStatsPool(2);
    AttrStats a = pool.acquire();
    AttrStats b = pool.acquire();
    AttrStats c = pool.acquire();
    pool.release(a);
    pool.release(b);
    pool.release(c);
    assertEquals(2, pool.idle());
  }
}
