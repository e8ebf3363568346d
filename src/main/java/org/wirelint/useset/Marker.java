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

import static org.wirelint.useset.UseSetFlag.FALSELY_SET;
import static org.wirelint.useset.UseSetFlag.FALSELY_USED;
import static org.wirelint.useset.UseSetFlag.SET_ABOVE;
import static org.wirelint.useset.UseSetFlag.TRULY_SET;
import static org.wirelint.useset.UseSetFlag.TRULY_USED;
import static org.wirelint.useset.UseSetFlag.USED_ABOVE;

import com.google.common.collect.ImmutableList;
import org.wirelint.ir.Assign;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Direction;
import org.wirelint.ir.Expr;
import org.wirelint.ir.ExprBits;
import org.wirelint.ir.GateInstance;
import org.wirelint.ir.GateInstance.GateArg;
import org.wirelint.ir.Module;
import org.wirelint.ir.NetDecl;
import org.wirelint.ir.PortDecl;
import org.wirelint.ir.ProceduralBlock;
import org.wirelint.ir.Statement;
import org.wirelint.ir.Statement.AssignStmt;
import org.wirelint.ir.Statement.BlockStmt;
import org.wirelint.ir.Statement.CaseItem;
import org.wirelint.ir.Statement.CaseStmt;
import org.wirelint.ir.Statement.DisableStmt;
import org.wirelint.ir.Statement.EnableStmt;
import org.wirelint.ir.Statement.ForStmt;
import org.wirelint.ir.Statement.ForeverStmt;
import org.wirelint.ir.Statement.IfStmt;
import org.wirelint.ir.Statement.NullStmt;
import org.wirelint.ir.Statement.RepeatStmt;
import org.wirelint.ir.Statement.TimingStmt;
import org.wirelint.ir.Statement.WaitStmt;
import org.wirelint.ir.Statement.WhileStmt;
import org.wirelint.ir.StatementVisitor;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.Warnings;

/**
 * Records which bits each construct of a module reads ({@code truly-used}) and drives ({@code
 * truly-set}).
 *
 * <p>Statements are visited children first: a compound statement such as {@code if} adds marks for
 * its own controlling expression after its sub-statements have contributed theirs.
 *
 * <p>The marking is purely syntactic, so it can be fooled: {@code assign foo = foo;} marks {@code
 * foo} both used and set, and {@code assign foo = bar & 0;} marks {@code bar} used.
 */
class Marker implements StatementVisitor<Void> {
  static final FlagSet USED = FlagSet.of(TRULY_USED);
  static final FlagSet SET = FlagSet.of(TRULY_SET);

  private final Module module;
  private final WireAlist alist;
  private final ExprBits exprBits;
  private final BitDatabase db;
  private final Warnings warnings;

  Marker(Module module, WireAlist alist, BitDatabase db, Warnings warnings) {
    this.module = module;
    this.alist = alist;
    this.exprBits = new ExprBits(alist);
    this.db = db;
    this.warnings = warnings;
  }

  /** Marks every bit that {@code expr} reads as {@code truly-used}. */
  void markUsed(Expr expr, Object context) {
    db.mark(exprBits.referencedBits(expr), USED, warnings, context);
  }

  /**
   * Marks the bits driven by assignment target {@code lhs} as {@code truly-set}, and the bits read
   * by any index expressions in it as {@code truly-used}.
   */
  void markSet(Expr lhs, Object context) {
    db.mark(exprBits.lhsBits(lhs), SET, warnings, context);
    db.mark(exprBits.lhsIndexBits(lhs), USED, warnings, context);
  }

  private void markAssignment(Expr lhs, Expr rhs, Object context) {
    markUsed(rhs, context);
    markSet(lhs, context);
  }

  /** Supply nets are always driven. */
  void markNetDecl(NetDecl decl) {
    if (decl.type.isSupply()) {
      db.mark(alist.bits(decl.name), SET, warnings, decl);
    }
  }

  void markAssign(Assign assign) {
    markAssignment(assign.lhs, assign.rhs, assign);
  }

  void markGate(GateInstance gate) {
    for (GateArg arg : gate.args) {
      if (arg.direction == null) {
        warnings.fudging(
            gate, "Direction of gate argument %s is unknown; treating it as used and set", arg);
        markUsed(arg.expr, gate);
        markSet(arg.expr, gate);
      } else {
        if (arg.direction.impliesUse()) {
          markUsed(arg.expr, gate);
        }
        if (arg.direction.impliesSet()) {
          markSet(arg.expr, gate);
        }
      }
    }
  }

  void markBlock(ProceduralBlock block) {
    block.body.accept(this);
  }

  /**
   * Nothing instantiates a top-level module, so we assume its environment drives its inputs and
   * reads its outputs.
   */
  void markTopLevelPorts() {
    for (PortDecl decl : module.portDecls) {
      FlagSet mask =
          switch (decl.direction) {
            case INPUT -> FlagSet.of(SET_ABOVE);
            case OUTPUT -> FlagSet.of(USED_ABOVE);
            case INOUT -> FlagSet.ABOVE;
          };
      db.mark(alist.bits(decl.name), mask, warnings, decl);
    }
  }

  /**
   * Marks input and inout bits that were never read as {@code falsely-used}, and output and inout
   * bits that were never driven as {@code falsely-set}. Must be called after everything else in the
   * module has been marked.
   */
  void markFalseInouts() {
    FlagSet falselyUsed = FlagSet.of(FALSELY_USED);
    FlagSet falselySet = FlagSet.of(FALSELY_SET);
    for (PortDecl decl : module.portDecls) {
      Direction direction = decl.direction;
      ImmutableList<BitId> bits = alist.bits(decl.name);
      for (BitId bit : bits) {
        FlagSet flags = db.query(bit);
        if (direction.impliesUse() && !flags.trulyUsed()) {
          db.mark(ImmutableList.of(bit), falselyUsed, warnings, decl);
        }
        if (direction.impliesSet() && !flags.trulySet()) {
          db.mark(ImmutableList.of(bit), falselySet, warnings, decl);
        }
      }
    }
  }

  @Override
  public Void visitAssign(AssignStmt stmt) {
    markAssignment(stmt.lhs, stmt.rhs, stmt);
    return null;
  }

  @Override
  public Void visitIf(IfStmt stmt) {
    stmt.then.accept(this);
    if (stmt.orElse != null) {
      stmt.orElse.accept(this);
    }
    markUsed(stmt.condition, stmt);
    return null;
  }

  @Override
  public Void visitCase(CaseStmt stmt) {
    for (CaseItem item : stmt.items) {
      item.body.accept(this);
    }
    if (stmt.defaultBody != null) {
      stmt.defaultBody.accept(this);
    }
    markUsed(stmt.selector, stmt);
    for (CaseItem item : stmt.items) {
      item.matches.forEach(m -> markUsed(m, stmt));
    }
    return null;
  }

  @Override
  public Void visitFor(ForStmt stmt) {
    stmt.body.accept(this);
    markAssignment(stmt.initLhs, stmt.initRhs, stmt);
    markUsed(stmt.test, stmt);
    markAssignment(stmt.nextLhs, stmt.nextRhs, stmt);
    return null;
  }

  @Override
  public Void visitWhile(WhileStmt stmt) {
    stmt.body.accept(this);
    markUsed(stmt.condition, stmt);
    return null;
  }

  @Override
  public Void visitRepeat(RepeatStmt stmt) {
    stmt.body.accept(this);
    markUsed(stmt.count, stmt);
    return null;
  }

  @Override
  public Void visitWait(WaitStmt stmt) {
    stmt.body.accept(this);
    markUsed(stmt.condition, stmt);
    return null;
  }

  @Override
  public Void visitForever(ForeverStmt stmt) {
    stmt.body.accept(this);
    return null;
  }

  @Override
  public Void visitTiming(TimingStmt stmt) {
    stmt.body.accept(this);
    stmt.control.exprs.forEach(e -> markUsed(e, stmt));
    return null;
  }

  @Override
  public Void visitBlock(BlockStmt stmt) {
    if (!stmt.decls.isEmpty()) {
      // Block-local wires would shadow the module's wires, and we don't track scopes.
      warnings.fudging(stmt, "Block declares local variables; ignoring the whole block");
      return null;
    }
    for (Statement s : stmt.statements) {
      s.accept(this);
    }
    return null;
  }

  @Override
  public Void visitEnable(EnableStmt stmt) {
    warnings.fudging(stmt, "Task and function enables are not supported; ignoring %s", stmt.name);
    return null;
  }

  @Override
  public Void visitDisable(DisableStmt stmt) {
    return null;
  }

  @Override
  public Void visitNull(NullStmt stmt) {
    return null;
  }
}
