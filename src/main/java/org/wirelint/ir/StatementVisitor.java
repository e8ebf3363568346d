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

import org.wirelint.ir.Statement.AssignStmt;
import org.wirelint.ir.Statement.BlockStmt;
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

/** One method for each kind of {@link Statement}. */
public interface StatementVisitor<T> {
  T visitAssign(AssignStmt stmt);

  T visitIf(IfStmt stmt);

  T visitCase(CaseStmt stmt);

  T visitFor(ForStmt stmt);

  T visitWhile(WhileStmt stmt);

  T visitRepeat(RepeatStmt stmt);

  T visitWait(WaitStmt stmt);

  T visitForever(ForeverStmt stmt);

  T visitTiming(TimingStmt stmt);

  T visitBlock(BlockStmt stmt);

  T visitEnable(EnableStmt stmt);

  T visitDisable(DisableStmt stmt);

  T visitNull(NullStmt stmt);
}
