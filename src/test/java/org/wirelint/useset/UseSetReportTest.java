/*
 * Copyright 2025 The Wirelint Authors
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

package org.wirelint.useset;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirelint.ir.BitId;

@RunWith(JUnit4.class)
public class UseSetReportTest {

  private final Locale savedLocale = Locale.getDefault();

  @After
  public void restoreLocale() {
    Locale.setDefault(savedLocale);
  }

  private static UseSetReport report() {
    Map<BitId, BitClass> classes = new LinkedHashMap<>();
    classes.put(BitId.scalar("o"), BitClass.TRAINWRECK);
    classes.put(BitId.of("v", 1), BitClass.UNUSED);
    classes.put(BitId.of("v", 0), BitClass.FINE);
    classes.put(BitId.scalar("i"), BitClass.FINE);
    return new UseSetReport("m", classes, ImmutableSet.of());
  }

  @Test
  public void summary() {
    UseSetReport report = report();
    assertThat(report.allFine()).isFalse();
    assertThat(report.bits(BitClass.FINE))
        .containsExactly(BitId.of("v", 0), BitId.scalar("i"))
        .inOrder();
    assertThat(report.toString()).isEqualTo("m: 2 fine; 1 unused [v[1]]; 1 trainwreck [o];");
  }

  @Test
  public void summaryIgnoresDefaultLocale() {
    // Lower-casing "I" under a Turkish locale gives a dotless i.
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    assertThat(report().toString()).isEqualTo("m: 2 fine; 1 unused [v[1]]; 1 trainwreck [o];");
  }
}
