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

package org.wirelint.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A Statement is an immutable procedural statement, found in the body of an {@code always} or
 * {@code initial} block.
 *
 * <p>All subclasses are nested here; each dispatches to the corresponding method of a {@link
 * StatementVisitor}.
 */
public abstract class Statement {

  private Statement() {}

  /** Calls the visitor method for this kind of statement. */
  public abstract <T> T accept(StatementVisitor<T> visitor);

  /** The flavors of procedural assignment. */
  public enum AssignKind {
    BLOCKING("="),
    NONBLOCKING("<="),
    ASSIGN("="),
    FORCE("=");

    final String op;

    AssignKind(String op) {
      this.op = op;
    }
  }

  /** {@code lhs = rhs;} (or one of the other {@link AssignKind}s). */
  public static final class AssignStmt extends Statement {
    public final AssignKind kind;
    public final Expr lhs;
    public final Expr rhs;

    public AssignStmt(AssignKind kind, Expr lhs, Expr rhs) {
      this.kind = Preconditions.checkNotNull(kind);
      this.lhs = Preconditions.checkNotNull(lhs);
      this.rhs = Preconditions.checkNotNull(rhs);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public String toString() {
      String prefix = "";
      if (kind == AssignKind.ASSIGN) {
        prefix = "assign ";
      } else if (kind == AssignKind.FORCE) {
        prefix = "force ";
      }
      return prefix + lhs + " " + kind.op + " " + rhs + ";";
    }
  }

  /** {@code if (condition) then else orElse}. */
  public static final class IfStmt extends Statement {
    public final Expr condition;
    public final Statement then;
    public final @Nullable Statement orElse;

    public IfStmt(Expr condition, Statement then, @Nullable Statement orElse) {
      this.condition = Preconditions.checkNotNull(condition);
      this.then = Preconditions.checkNotNull(then);
      this.orElse = orElse;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public String toString() {
      return "if (" + condition + ") " + then + ((orElse == null) ? "" : " else " + orElse);
    }
  }

  /** One arm of a case statement. */
  public static final class CaseItem {
    public final ImmutableList<Expr> matches;
    public final Statement body;

    public CaseItem(List<Expr> matches, Statement body) {
      Preconditions.checkArgument(!matches.isEmpty());
      this.matches = ImmutableList.copyOf(matches);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public String toString() {
      return matches.stream().map(Expr::toString).collect(Collectors.joining(", ")) + ": " + body;
    }
  }

  /** {@code case (selector) items... default: defaultBody endcase}. */
  public static final class CaseStmt extends Statement {
    public final Expr selector;
    public final ImmutableList<CaseItem> items;
    public final @Nullable Statement defaultBody;

    public CaseStmt(Expr selector, List<CaseItem> items, @Nullable Statement defaultBody) {
      this.selector = Preconditions.checkNotNull(selector);
      this.items = ImmutableList.copyOf(items);
      this.defaultBody = defaultBody;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitCase(this);
    }

    @Override
    public String toString() {
      return "case (" + selector + ") ... endcase";
    }
  }

  /** {@code for (initLhs = initRhs; test; nextLhs = nextRhs) body}. */
  public static final class ForStmt extends Statement {
    public final Expr initLhs;
    public final Expr initRhs;
    public final Expr test;
    public final Expr nextLhs;
    public final Expr nextRhs;
    public final Statement body;

    public ForStmt(
        Expr initLhs, Expr initRhs, Expr test, Expr nextLhs, Expr nextRhs, Statement body) {
      this.initLhs = Preconditions.checkNotNull(initLhs);
      this.initRhs = Preconditions.checkNotNull(initRhs);
      this.test = Preconditions.checkNotNull(test);
      this.nextLhs = Preconditions.checkNotNull(nextLhs);
      this.nextRhs = Preconditions.checkNotNull(nextRhs);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    public String toString() {
      return String.format(
          "for (%s = %s; %s; %s = %s) %s", initLhs, initRhs, test, nextLhs, nextRhs, body);
    }
  }

  /** {@code while (condition) body}. */
  public static final class WhileStmt extends Statement {
    public final Expr condition;
    public final Statement body;

    public WhileStmt(Expr condition, Statement body) {
      this.condition = Preconditions.checkNotNull(condition);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public String toString() {
      return "while (" + condition + ") " + body;
    }
  }

  /** {@code repeat (count) body}. */
  public static final class RepeatStmt extends Statement {
    public final Expr count;
    public final Statement body;

    public RepeatStmt(Expr count, Statement body) {
      this.count = Preconditions.checkNotNull(count);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitRepeat(this);
    }

    @Override
    public String toString() {
      return "repeat (" + count + ") " + body;
    }
  }

  /** {@code wait (condition) body}. */
  public static final class WaitStmt extends Statement {
    public final Expr condition;
    public final Statement body;

    public WaitStmt(Expr condition, Statement body) {
      this.condition = Preconditions.checkNotNull(condition);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitWait(this);
    }

    @Override
    public String toString() {
      return "wait (" + condition + ") " + body;
    }
  }

  /** {@code forever body}. */
  public static final class ForeverStmt extends Statement {
    public final Statement body;

    public ForeverStmt(Statement body) {
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitForever(this);
    }

    @Override
    public String toString() {
      return "forever " + body;
    }
  }

  /** A statement preceded by a delay or event control, e.g. {@code @(posedge clk) q <= d;}. */
  public static final class TimingStmt extends Statement {
    public final TimingControl control;
    public final Statement body;

    public TimingStmt(TimingControl control, Statement body) {
      this.control = Preconditions.checkNotNull(control);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitTiming(this);
    }

    @Override
    public String toString() {
      return control + " " + body;
    }
  }

  /**
   * {@code begin ... end} (sequential) or {@code fork ... join} (parallel), optionally named and
   * optionally declaring block-local variables.
   */
  public static final class BlockStmt extends Statement {
    public final boolean sequential;
    public final @Nullable String name;
    public final ImmutableList<NetDecl> decls;
    public final ImmutableList<Statement> statements;

    public BlockStmt(
        boolean sequential,
        @Nullable String name,
        List<NetDecl> decls,
        List<Statement> statements) {
      this.sequential = sequential;
      this.name = name;
      this.decls = ImmutableList.copyOf(decls);
      this.statements = ImmutableList.copyOf(statements);
    }

    /** Returns an unnamed sequential block with no declarations. */
    public static BlockStmt of(Statement... statements) {
      return new BlockStmt(true, null, ImmutableList.of(), ImmutableList.copyOf(statements));
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
      String open = sequential ? "begin" : "fork";
      if (name != null) {
        open += " : " + name;
      }
      return open + " ... " + (sequential ? "end" : "join");
    }
  }

  /** A task or function enable, e.g. {@code do_thing(a, b);}. */
  public static final class EnableStmt extends Statement {
    public final String name;
    public final ImmutableList<Expr> args;

    public EnableStmt(String name, List<Expr> args) {
      this.name = Preconditions.checkNotNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitEnable(this);
    }

    @Override
    public String toString() {
      return name + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ");"));
    }
  }

  /** {@code disable name;}. */
  public static final class DisableStmt extends Statement {
    public final String target;

    public DisableStmt(String target) {
      this.target = Preconditions.checkNotNull(target);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitDisable(this);
    }

    @Override
    public String toString() {
      return "disable " + target + ";";
    }
  }

  /** The empty statement {@code ;}. */
  public static final class NullStmt extends Statement {
    public static final NullStmt INSTANCE = new NullStmt();

    private NullStmt() {}

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitNull(this);
    }

    @Override
    public String toString() {
      return ";";
    }
  }
}
