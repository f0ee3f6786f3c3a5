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

/**
 * Visits and transforms terms.
 *
 * <p>Each method returns the term unchanged if none of its children changed.
 */
public class Shuttle {
  protected Term visit(Term.Var var) {
    return var;
  }

  protected Term visit(Term.Num num) {
    return num;
  }

  protected Term visit(Term.Abs abs) {
    return abs.copy(abs.param, abs.body.accept(this));
  }

  protected Term visit(Term.App app) {
    return app.copy(app.fn.accept(this), app.arg.accept(this));
  }

  protected Term visit(Term.BinOp binOp) {
    return binOp.copy(binOp.left.accept(this), binOp.right.accept(this));
  }

  protected Term visit(Term.Neg neg) {
    return neg.copy(neg.operand.accept(this));
  }
}

// End Shuttle.java
