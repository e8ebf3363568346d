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
import static org.wirelint.ir.Expr.constant;
import static org.wirelint.ir.Expr.id;
import static org.wirelint.ir.Expr.integer;
import static org.wirelint.ir.Expr.op;
import static org.wirelint.ir.Expr.select;
import static org.wirelint.useset.UseSetFlag.FALSELY_SET;
import static org.wirelint.useset.UseSetFlag.FALSELY_USED;
import static org.wirelint.useset.UseSetFlag.SET_ABOVE;
import static org.wirelint.useset.UseSetFlag.TRULY_SET;
import static org.wirelint.useset.UseSetFlag.TRULY_USED;
import static org.wirelint.useset.UseSetFlag.USED_ABOVE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Expr;
import org.wirelint.ir.GateInstance;
import org.wirelint.ir.GateInstance.GateArg;
import org.wirelint.ir.Module;
import org.wirelint.ir.NetDecl;
import org.wirelint.ir.NetType;
import org.wirelint.ir.Statement;
import org.wirelint.ir.Statement.AssignKind;
import org.wirelint.ir.Statement.AssignStmt;
import org.wirelint.ir.Statement.BlockStmt;
import org.wirelint.ir.Statement.CaseItem;
import org.wirelint.ir.Statement.CaseStmt;
import org.wirelint.ir.Statement.EnableStmt;
import org.wirelint.ir.Statement.ForStmt;
import org.wirelint.ir.Statement.IfStmt;
import org.wirelint.ir.Statement.TimingStmt;
import org.wirelint.ir.Statement.WhileStmt;
import org.wirelint.ir.TimingControl;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.Warning;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

@RunWith(JUnit4.class)
public class MarkerTest {

  private static final FlagSet USED = FlagSet.of(TRULY_USED);
  private static final FlagSet SET = FlagSet.of(TRULY_SET);
  private static final FlagSet BOTH = FlagSet.of(TRULY_USED, TRULY_SET);

  private final Warnings warnings = new Warnings("m");

  /** Marks everything in {@code module} the way pass 1 does, except for instances. */
  private BitDatabase mark(Module module, boolean topLevel) {
    WireAlist alist = WireAlist.forModule(module, warnings);
    BitDatabase db = BitDatabase.initialize(module.name, alist);
    Marker marker = new Marker(module, alist, db, warnings);
    if (topLevel) {
      marker.markTopLevelPorts();
    }
    module.netDecls.forEach(marker::markNetDecl);
    module.assigns.forEach(marker::markAssign);
    module.gates.forEach(marker::markGate);
    module.blocks.forEach(marker::markBlock);
    marker.markFalseInouts();
    return db;
  }

  private BitDatabase mark(Module module) {
    return mark(module, false);
  }

  private static FlagSet flags(BitDatabase db, String wire) {
    return db.query(BitId.scalar(wire));
  }

  private static Statement blocking(Expr lhs, Expr rhs) {
    return new AssignStmt(AssignKind.BLOCKING, lhs, rhs);
  }

  private static Statement nonblocking(Expr lhs, Expr rhs) {
    return new AssignStmt(AssignKind.NONBLOCKING, lhs, rhs);
  }

  @Test
  public void continuousAssign() {
    Module module =
        Module.builder("m")
            .wire("a")
            .wire("b")
            .wire("o")
            .assign(id("o"), op("&", id("a"), id("b")))
            .build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "a")).isSameInstanceAs(USED);
    assertThat(flags(db, "b")).isSameInstanceAs(USED);
    assertThat(flags(db, "o")).isSameInstanceAs(SET);
    assertThat(warnings.isEmpty()).isTrue();
  }

  @Test
  public void selfAssignmentLooksFine() {
    Module module = Module.builder("m").wire("foo").assign(id("foo"), id("foo")).build();
    assertThat(flags(mark(module), "foo")).isSameInstanceAs(BOTH);
  }

  @Test
  public void constantMaskingStillUses() {
    Module module =
        Module.builder("m")
            .wire("foo")
            .wire("bar")
            .assign(id("foo"), op("&", id("bar"), constant(1, 0)))
            .build();
    assertThat(flags(mark(module), "bar")).isSameInstanceAs(USED);
  }

  @Test
  public void clockedIf() {
    // always @(posedge clk) if (en) q <= d;
    Statement body =
        new TimingStmt(
            TimingControl.event(id("clk")),
            new IfStmt(id("en"), nonblocking(id("q"), id("d")), null));
    Module module =
        Module.builder("m").wire("clk").wire("en").wire("d").reg("q").always(body).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "clk")).isSameInstanceAs(USED);
    assertThat(flags(db, "en")).isSameInstanceAs(USED);
    assertThat(flags(db, "d")).isSameInstanceAs(USED);
    assertThat(flags(db, "q")).isSameInstanceAs(SET);
  }

  @Test
  public void delayIsUsed() {
    Statement body =
        new TimingStmt(TimingControl.delay(id("period")), blocking(id("clk"), op("~", id("clk"))));
    Module module = Module.builder("m").reg("clk").wire("period").initial(body).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "period")).isSameInstanceAs(USED);
    assertThat(flags(db, "clk")).isSameInstanceAs(BOTH);
  }

  @Test
  public void forLoopWithVariableIndex() {
    // for (i = 0; i < n; i = i + 1) mem[i] = 0;
    Statement loop =
        new ForStmt(
            id("i"),
            integer(0),
            op("<", id("i"), id("n")),
            id("i"),
            op("+", id("i"), integer(1)),
            blocking(select("mem", id("i")), integer(0)));
    Module module =
        Module.builder("m")
            .reg("mem", 3, 0)
            .net(integerDecl("i"))
            .wire("n")
            .initial(loop)
            .build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "i")).isSameInstanceAs(BOTH);
    assertThat(flags(db, "n")).isSameInstanceAs(USED);
    for (int j = 0; j < 4; j++) {
      assertThat(db.query(BitId.of("mem", j))).isSameInstanceAs(SET);
    }
  }

  private static NetDecl integerDecl(String name) {
    return new NetDecl(name, NetType.INTEGER, null);
  }

  @Test
  public void caseSelectorAndLabelsAreUsed() {
    Statement body =
        new CaseStmt(
            id("sel"),
            ImmutableList.of(
                new CaseItem(ImmutableList.of(id("k")), blocking(id("y"), id("a")))),
            blocking(id("y"), id("b")));
    Module module =
        Module.builder("m")
            .wire("sel")
            .wire("k")
            .wire("a")
            .wire("b")
            .reg("y")
            .always(new TimingStmt(TimingControl.star(), body))
            .build();
    BitDatabase db = mark(module);
    for (String used : ImmutableList.of("sel", "k", "a", "b")) {
      assertThat(flags(db, used)).isSameInstanceAs(USED);
    }
    assertThat(flags(db, "y")).isSameInstanceAs(SET);
  }

  @Test
  public void whileCondition() {
    Statement body =
        new WhileStmt(id("busy"), blocking(id("count"), op("+", id("count"), integer(1))));
    Module module = Module.builder("m").wire("busy").reg("count", 7, 0).initial(body).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "busy")).isSameInstanceAs(USED);
    assertThat(db.query(BitId.of("count", 7))).isSameInstanceAs(BOTH);
  }

  @Test
  public void supplyNetsAreSet() {
    Module module =
        Module.builder("m")
            .net(new NetDecl("vdd", NetType.SUPPLY1, null))
            .net(new NetDecl("gnd", NetType.SUPPLY0, null))
            .wire("w")
            .build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "vdd")).isSameInstanceAs(SET);
    assertThat(flags(db, "gnd")).isSameInstanceAs(SET);
    assertThat(flags(db, "w")).isSameInstanceAs(FlagSet.EMPTY);
  }

  @Test
  public void gates() {
    GateInstance and =
        new GateInstance(
            "and",
            "g1",
            ImmutableList.of(
                GateArg.output(id("o")), GateArg.input(id("a")), GateArg.input(id("b"))));
    Module module = Module.builder("m").wire("o").wire("a").wire("b").gate(and).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "o")).isSameInstanceAs(SET);
    assertThat(flags(db, "a")).isSameInstanceAs(USED);
    assertThat(warnings.isEmpty()).isTrue();
  }

  @Test
  public void gateArgumentWithUnknownDirection() {
    GateInstance tran =
        new GateInstance("tran", null, ImmutableList.of(new GateArg(null, id("x"))));
    Module module = Module.builder("m").wire("x").gate(tran).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "x")).isSameInstanceAs(BOTH);
    Warning warning = Iterables.getOnlyElement(warnings.toList());
    assertThat(warning.type).isEqualTo(WarningType.USESET_FUDGING);
  }

  @Test
  public void blockWithDeclarationsIsSkipped() {
    Statement block =
        new BlockStmt(
            true,
            "scope",
            ImmutableList.of(integerDecl("tmp")),
            ImmutableList.of(blocking(id("y"), id("a"))));
    Module module = Module.builder("m").wire("a").reg("y").always(block).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "a")).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(flags(db, "y")).isSameInstanceAs(FlagSet.EMPTY);
    Warning warning = Iterables.getOnlyElement(warnings.toList());
    assertThat(warning.type).isEqualTo(WarningType.USESET_FUDGING);
    assertThat(warning.fatal).isFalse();
  }

  @Test
  public void taskEnableIsSkipped() {
    Statement body =
        BlockStmt.of(
            new EnableStmt("do_thing", ImmutableList.of(id("a"))), blocking(id("y"), id("b")));
    Module module = Module.builder("m").wire("a").wire("b").reg("y").initial(body).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "a")).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(flags(db, "b")).isSameInstanceAs(USED);
    assertThat(Iterables.getOnlyElement(warnings.toList()).type)
        .isEqualTo(WarningType.USESET_FUDGING);
  }

  @Test
  public void undeclaredWire() {
    Module module = Module.builder("m").wire("o").assign(id("o"), id("ghost")).build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "ghost")).isSameInstanceAs(USED);
    assertThat(Iterables.getOnlyElement(warnings.toList()).type)
        .isEqualTo(WarningType.USESET_UNDECLARED);
  }

  @Test
  public void topLevelPorts() {
    Module module =
        Module.builder("top")
            .input("i")
            .output("o")
            .inout("io")
            .assign(id("o"), id("i"))
            .build();
    BitDatabase db = mark(module, true);
    assertThat(flags(db, "i")).isSameInstanceAs(FlagSet.of(TRULY_USED, SET_ABOVE));
    assertThat(flags(db, "o")).isSameInstanceAs(FlagSet.of(TRULY_SET, USED_ABOVE));
    assertThat(flags(db, "io"))
        .isSameInstanceAs(FlagSet.of(FALSELY_USED, FALSELY_SET, USED_ABOVE, SET_ABOVE));
  }

  @Test
  public void falseInouts() {
    Module module =
        Module.builder("m")
            .input("unread")
            .input("read")
            .output("undriven")
            .output("driven")
            .inout("bus")
            .assign(id("driven"), id("read"))
            .assign(id("tmp"), id("bus"))
            .wire("tmp")
            .build();
    BitDatabase db = mark(module);
    assertThat(flags(db, "unread")).isSameInstanceAs(FlagSet.of(FALSELY_USED));
    assertThat(flags(db, "read")).isSameInstanceAs(USED);
    assertThat(flags(db, "undriven")).isSameInstanceAs(FlagSet.of(FALSELY_SET));
    assertThat(flags(db, "driven")).isSameInstanceAs(SET);
    // Read but not driven: only the missing half is false.
    assertThat(flags(db, "bus")).isSameInstanceAs(FlagSet.of(TRULY_USED, FALSELY_SET));
  }
}
