/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lambda.ast;

/** Visits terms. */
public class Visitor {
  protected void visit(Term.Var var) {}

  protected void visit(Term.Num num) {}

  protected void visit(Term.Abs abs) {
    abs.body.accept(this);
  }

  protected void visit(Term.App app) {
    app.fn.accept(this);
    app.arg.accept(this);
  }

  protected void visit(Term.BinOp binOp) {
    binOp.left.accept(this);
    binOp.right.accept(this);
  }

  protected void visit(Term.Neg neg) {
    neg.operand.accept(this);
  }
}

// End Visitor.java
