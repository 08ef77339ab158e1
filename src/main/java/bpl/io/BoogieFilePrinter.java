// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package bpl.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import bpl.core.BigBlock;
import bpl.core.Block;
import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.LVal;
import bpl.core.BoogieFile.Type;
import bpl.core.StmtList;
import bpl.core.StructuredCmd;
import bpl.core.TransferCmd;
import bpl.tasks.CallDesugarer;
import bpl.util.MappablePrintWriter;

public class BoogieFilePrinter {
	private final MappablePrintWriter<BoogieFile.Item> out;
	/**
	 * Print the desugaring of each (resolved) call beneath it, inside a comment.
	 */
	private boolean printDesugarings = false;

	public BoogieFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public BoogieFilePrinter setPrintDesugarings(boolean flag) {
		this.printDesugarings = flag;
		return this;
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<BoogieFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(BoogieFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if(d instanceof Decl.Axiom) {
			writeAxiom(indent, (Decl.Axiom) d);
		} else if(d instanceof Decl.Constant) {
			writeConstant(indent,(Decl.Constant) d);
		} else if(d instanceof Decl.Function) {
			writeFunction(indent,(Decl.Function) d);
		} else if(d instanceof Decl.Implementation) {
			writeImplementation(indent,(Decl.Implementation) d);
		} else if(d instanceof Decl.LineComment) {
			writeLineComment(indent,(Decl.LineComment) d);
		} else if(d instanceof Decl.Procedure) {
			writeProcedure(indent,(Decl.Procedure) d);
		} else if(d instanceof Decl.Variable) {
			writeVariable(indent,(Decl.Variable) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeAxiom(int indent, Decl.Axiom d) {
		out.tab(indent);
		out.print("axiom ",d);
		writeExpression(d.getOperand());
		out.println(";",d);
	}

	private void writeConstant(int indent, Decl.Constant d) {
		out.tab(indent);
		out.print("const ",d);
		if(d.isUnique()) {
			out.print("unique ",d);
		}
		out.print(d.getName(),d);
		out.print(" : ",d);
		writeType(d.getType());
		out.println(";",d);
	}

	private void writeFunction(int indent, Decl.Function d) {
		out.tab(indent);
		out.print("function ",d);
		out.print(d.getName(),d);
		writeParameters(d.getParameters());
		out.print(" returns (",d);
		writeType(d.getReturns());
		out.print(")",d);
		if(d.getBody() != null) {
			out.println(" {",d);
			out.tab(indent+1);
			writeExpression(d.getBody());
			out.println();
			out.tab(indent);
			out.println("}",d);
		} else {
			out.println(";",d);
		}
	}

	private void writeLineComment(int indent, Decl.LineComment d) {
		out.tab(indent);
		out.println("// " + d.getMessage(), d);
	}

	private void writeProcedure(int indent, Decl.Procedure d) {
		out.tab(indent);
		out.print("procedure ",d);
		out.print(d.getName(),d);
		List<String> typeParameters = d.getTypeParameters();
		if(!typeParameters.isEmpty()) {
			out.print("<" + String.join(", ", typeParameters) + ">", d);
		}
		writeParameters(d.getParameters());
		if(!d.getReturns().isEmpty()) {
			out.print(" returns ",d);
			writeParameters(d.getReturns());
		}
		out.println(";",d);
		writeSpecification(indent + 1, "requires ", d.getRequires());
		writeSpecification(indent + 1, "free requires ", d.getFreeRequires());
		List<String> modifies = d.getModifies();
		if(modifies.size() > 0) {
			out.tab(indent + 1);
			out.print("modifies ",d);
			out.print(String.join(", ", modifies),d);
			out.println(";",d);
		}
		writeSpecification(indent + 1, "ensures ", d.getEnsures());
		writeSpecification(indent + 1, "free ensures ", d.getFreeEnsures());
	}

	private void writeSpecification(int indent, String keyword, List<Expr.Logical> clauses) {
		for(int i=0;i!=clauses.size();++i) {
			Expr.Logical ith = clauses.get(i);
			out.tab(indent);
			out.print(keyword, ith);
			writeExpression(ith);
			out.println(";", ith);
		}
	}

	private void writeImplementation(int indent, Decl.Implementation d) {
		out.tab(indent);
		out.print("implementation ",d);
		out.print(d.getName(),d);
		writeParameters(d.getParameters());
		if(!d.getReturns().isEmpty()) {
			out.print(" returns ",d);
			writeParameters(d.getReturns());
		}
		out.println();
		out.tab(indent);
		out.println("{",d);
		List<Decl.Variable> locals = d.getLocals();
		for(int i=0;i!=locals.size();++i) {
			writeVariable(indent + 1, locals.get(i));
		}
		if(!locals.isEmpty()) {
			out.println();
		}
		if(d.getBlocks() != null) {
			writeBlocks(indent + 1, d.getBlocks());
		} else {
			writeStmtList(indent + 1, d.getBody());
		}
		out.tab(indent);
		out.println("}",d);
		out.println();
	}

	private void writeParameters(List<? extends Decl.Parameter> parameters) {
		out.print("(");
		for(int i=0;i!=parameters.size();++i) {
			Decl.Parameter ith = parameters.get(i);
			if(i != 0) {
				out.print(", ",ith);
			}
			writeParameter(ith);
		}
		out.print(")");
	}

	private void writeParameter(Decl.Parameter parameter) {
		out.print(parameter.getName(), parameter);
		out.print(" : ", parameter);
		writeType(parameter.getType());
		if (parameter instanceof Decl.Variable && ((Decl.Variable) parameter).getWhere() != null) {
			out.print(" where ", parameter);
			writeExpression(((Decl.Variable) parameter).getWhere());
		}
	}

	private void writeVariable(int indent, Decl.Variable d) {
		out.tab(indent);
		out.print("var ", d);
		writeParameter(d);
		out.println(";", d);
	}

	// =====================================================================
	// Structured Bodies
	// =====================================================================

	private void writeStmtList(int indent, StmtList stmts) {
		for (BigBlock b : stmts.getBigBlocks()) {
			writeBigBlock(indent, b);
		}
	}

	private void writeBigBlock(int indent, BigBlock b) {
		if (!b.isAnonymous()) {
			out.tab(indent - 1);
			out.println(b.getLabel() + ":");
		}
		for (Cmd c : b.getSimpleCmds()) {
			writeCmd(indent, c);
		}
		if (b.getStructuredCmd() != null) {
			writeStructuredCmd(indent, b.getStructuredCmd());
		} else if (b.getTransferCmd() != null) {
			writeTransferCmd(indent, b.getTransferCmd());
		}
	}

	private void writeStructuredCmd(int indent, StructuredCmd s) {
		if (s instanceof StructuredCmd.If) {
			out.tab(indent);
			writeIf(indent, (StructuredCmd.If) s);
			out.println();
		} else if (s instanceof StructuredCmd.While) {
			writeWhile(indent, (StructuredCmd.While) s);
		} else if (s instanceof StructuredCmd.Break) {
			StructuredCmd.Break b = (StructuredCmd.Break) s;
			out.tab(indent);
			out.println(b.getLabel() == null ? "break;" : "break " + b.getLabel() + ";");
		} else {
			throw new IllegalArgumentException("unknown structured command encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeIf(int indent, StructuredCmd.If s) {
		out.print("if (");
		writeGuard(s.getGuard());
		out.println(") {");
		writeStmtList(indent + 1, s.getThen());
		out.tab(indent);
		out.print("}");
		if (s.getElseIf() != null) {
			out.print(" else ");
			writeIf(indent, s.getElseIf());
		} else if (s.getElse() != null) {
			out.println(" else {");
			writeStmtList(indent + 1, s.getElse());
			out.tab(indent);
			out.print("}");
		}
	}

	private void writeWhile(int indent, StructuredCmd.While s) {
		out.tab(indent);
		out.print("while (");
		writeGuard(s.getGuard());
		out.println(")");
		for (Cmd.Predicate inv : s.getInvariants()) {
			out.tab(indent + 1);
			out.print(inv instanceof Cmd.Assume ? "free invariant " : "invariant ", inv);
			writeExpression(inv.getCondition());
			out.println(";", inv);
		}
		out.tab(indent);
		out.println("{");
		writeStmtList(indent + 1, s.getBody());
		out.tab(indent);
		out.println("}");
	}

	private void writeGuard(Expr.Logical guard) {
		if (guard == null) {
			out.print("*");
		} else {
			writeExpression(guard);
		}
	}

	private void writeTransferCmd(int indent, TransferCmd t) {
		out.tab(indent);
		if (t instanceof TransferCmd.Goto) {
			out.println("goto " + String.join(", ", ((TransferCmd.Goto) t).getLabels()) + ";");
		} else if (t instanceof TransferCmd.Return) {
			out.println("return;");
		} else {
			throw new IllegalArgumentException("unknown transfer command encountered (" + t.getClass().getName() + ")");
		}
	}

	// =====================================================================
	// Blocks
	// =====================================================================

	private void writeBlocks(int indent, List<Block> blocks) {
		for (int i = 0; i != blocks.size(); ++i) {
			if (i != 0) {
				out.println();
			}
			writeBlock(indent, blocks.get(i));
		}
	}

	private void writeBlock(int indent, Block b) {
		out.tab(indent - 1);
		out.println(b.getLabel() + ":");
		for (Cmd c : b.getCmds()) {
			writeCmd(indent, c);
		}
		writeTransferCmd(indent, b.getTransferCmd());
	}

	// =====================================================================
	// Commands
	// =====================================================================

	private void writeCmd(int indent, Cmd c) {
		if(c instanceof Cmd.Assignment) {
			writeAssignment(indent,(Cmd.Assignment) c);
		} else if(c instanceof Cmd.Assert) {
			writeAssert(indent,(Cmd.Assert) c);
		} else if(c instanceof Cmd.Assume) {
			writeAssume(indent,(Cmd.Assume) c);
		} else if(c instanceof Cmd.Havoc) {
			writeHavoc(indent,(Cmd.Havoc) c);
		} else if(c instanceof Cmd.Call) {
			writeCall(indent,(Cmd.Call) c);
		} else if(c instanceof Cmd.CallForall) {
			writeCallForall(indent,(Cmd.CallForall) c);
		} else if(c instanceof Cmd.Comment) {
			out.tab(indent);
			out.println("// " + ((Cmd.Comment) c).getMessage(), c);
		} else if(c instanceof Cmd.State) {
			writeState(indent,(Cmd.State) c);
		} else {
			throw new IllegalArgumentException("unknown command encountered (" + c.getClass().getName() + ")");
		}
	}

	private void writeAssignment(int indent, Cmd.Assignment s) {
		out.tab(indent);
		List<LVal> lhs = s.getLeftHandSides();
		for (int i = 0; i != lhs.size(); ++i) {
			if (i != 0) {
				out.print(", ", s);
			}
			writeExpression(lhs.get(i));
		}
		out.print(" := ", s);
		writeExpressions(s.getRightHandSides(), s);
		out.println(";", s);
	}

	private void writeAssert(int indent, Cmd.Assert s) {
		out.tab(indent);
		out.print("assert ", s);
		writeExpression(s.getCondition());
		out.println(";", s);
	}

	private void writeAssume(int indent, Cmd.Assume s) {
		out.tab(indent);
		out.print("assume ",s);
		writeExpression(s.getCondition());
		out.println(";", s);
	}

	private void writeHavoc(int indent, Cmd.Havoc s) {
		out.tab(indent);
		out.print("havoc ", s);
		List<Expr.VariableAccess> vars = s.getVariables();
		for (int i = 0; i != vars.size(); ++i) {
			if (i != 0) {
				out.print(", ", s);
			}
			writeExpression(vars.get(i));
		}
		out.println(";", s);
	}

	private void writeCall(int indent, Cmd.Call s) {
		out.tab(indent);
		out.print(s.isAsync() ? "call {:async} " : "call ", s);
		List<Expr.VariableAccess> outs = s.getOuts();
		if (outs.size() > 0) {
			for (int i = 0; i != outs.size(); ++i) {
				if (i != 0) {
					out.print(", ", s);
				}
				writeWildcardOr(outs.get(i), s);
			}
			out.print(" := ", s);
		}
		out.print(s.getCallee(), s);
		out.print("(", s);
		writeArguments(s.getIns(), s);
		out.println(");", s);
		writeDesugaring(indent, s);
	}

	private void writeCallForall(int indent, Cmd.CallForall s) {
		out.tab(indent);
		out.print("call forall ", s);
		out.print(s.getCallee(), s);
		out.print("(", s);
		writeArguments(s.getIns(), s);
		out.println(");", s);
		writeDesugaring(indent, s);
	}

	private void writeDesugaring(int indent, Cmd.CallCommonality s) {
		if (printDesugarings && s.isResolved()) {
			out.tab(indent);
			out.println("/*** desugaring:", s);
			writeState(indent, CallDesugarer.getDesugaring(s));
			out.tab(indent);
			out.println("**** end desugaring */", s);
		}
	}

	private void writeArguments(List<Expr> args, Cmd s) {
		for (int i = 0; i != args.size(); ++i) {
			if (i != 0) {
				out.print(", ", s);
			}
			writeWildcardOr(args.get(i), s);
		}
	}

	private void writeWildcardOr(Expr e, Cmd s) {
		if (e == null) {
			out.print("*", s);
		} else {
			writeExpression(e);
		}
	}

	private void writeState(int indent, Cmd.State s) {
		out.tab(indent);
		out.println("{", s);
		for (Decl.Variable v : s.getLocals()) {
			writeVariable(indent + 1, v);
		}
		for (Cmd c : s.getCmds()) {
			writeCmd(indent + 1, c);
		}
		out.tab(indent);
		out.println("}", s);
	}

	// =====================================================================
	// Expressions
	// =====================================================================

	private void writeExpressions(List<Expr> exprs, BoogieFile.Item tag) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(", ", tag);
			}
			writeExpression(exprs.get(i));
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		if ((e instanceof Expr.UnaryOperator && !(e instanceof Expr.Old)) || e instanceof Expr.BinaryOperator || e instanceof Expr.NaryOperator) {
			out.print("(",e);
			writeExpression(e);
			out.print(")",e);
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if(e instanceof Expr.DictionaryAccess) {
			writeDictionaryAccess((Expr.DictionaryAccess) e);
		} else if(e instanceof Expr.DictionaryUpdate) {
			writeDictionaryUpdate((Expr.DictionaryUpdate) e);
		} else if(e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " == ", e);
		} else if(e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, " != ", e);
		} else if(e instanceof Expr.Iff) {
			writeInfix((Expr.BinaryOperator) e, " <==> ", e);
		} else if(e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, " ==> ", e);
		} else if(e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ", e);
		} else if(e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " <= ", e);
		} else if(e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ", e);
		} else if(e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " >= ", e);
		} else if(e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ", e);
		} else if(e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ", e);
		} else if(e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ", e);
		} else if(e instanceof Expr.IntegerDivision) {
			writeInfix((Expr.BinaryOperator) e, " div ", e);
		} else if(e instanceof Expr.Remainder) {
			writeInfix((Expr.BinaryOperator) e, " mod ", e);
		} else if(e instanceof Expr.Boolean) {
			out.print(((Expr.Boolean) e).getValue() ? "true" : "false", e);
		} else if(e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue().toString(), e);
		} else if(e instanceof Expr.LogicalAnd) {
			writeNary(((Expr.LogicalAnd) e).getOperands(), " && ", e);
		} else if(e instanceof Expr.LogicalOr) {
			writeNary(((Expr.LogicalOr) e).getOperands(), " || ", e);
		} else if(e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if(e instanceof Expr.Invoke) {
			writeInvoke((Expr.Invoke) e);
		} else if(e instanceof Expr.LogicalNot) {
			out.print("!",e);
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if(e instanceof Expr.Old) {
			out.print("old(",e);
			writeExpression(((Expr.Old) e).getOperand());
			out.print(")",e);
		} else if(e instanceof Expr.Negation) {
			out.print("-",e);
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if(e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable(),e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator, Expr tag) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator,tag);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeNary(List<Expr.Logical> operands, String operator, Expr tag) {
		for(int i=0;i!=operands.size();++i) {
			if(i != 0) {
				out.print(operator,tag);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeDictionaryAccess(Expr.DictionaryAccess e) {
		writeExpression(e.getSource());
		out.print("[",e);
		writeExpression(e.getIndex());
		out.print("]",e);
	}

	private void writeDictionaryUpdate(Expr.DictionaryUpdate e) {
		writeExpression(e.getSource());
		out.print("[",e);
		writeExpression(e.getIndex());
		out.print(" := ",e);
		writeExpression(e.getValue());
		out.print("]",e);
	}

	private void writeInvoke(Expr.Invoke e) {
		out.print(e.getName(),e);
		out.print("(",e);
		writeExpressions(e.getArguments(), e);
		out.print(")",e);
	}

	private void writeQuantifier(Expr.Quantifier e) {
		out.print("(", e);
		List<Decl.Parameter> params = e.getParameters();
		if (e instanceof Expr.UniversalQuantifier) {
			out.print("forall ", e);
		} else {
			out.print("exists ", e);
		}
		for (int i = 0; i != params.size(); ++i) {
			if (i != 0) {
				out.print(", ", e);
			}
			writeParameter(params.get(i));
		}
		out.print(" :: ", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeType(Type t) {
		if(t instanceof Type.Bool) {
			out.print("bool",t);
		} else if(t instanceof Type.Int) {
			out.print("int",t);
		} else if(t instanceof Type.Real) {
			out.print("real",t);
		} else if(t instanceof Type.Synonym) {
			out.print(((Type.Synonym) t).getSynonym(),t);
		} else if(t instanceof Type.Variable) {
			out.print(((Type.Variable) t).getName(),t);
		} else if(t instanceof Type.BitVector) {
			out.print("bv" + ((Type.BitVector) t).getDigits(),t);
		} else if(t instanceof Type.Dictionary) {
			Type.Dictionary m = (Type.Dictionary) t;
			out.print("[",t);
			writeType(m.getKey());
			out.print("]",t);
			writeType(m.getValue());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.writeExpression(expr);
		return p.contents(buf);
	}

	public static String toString(Cmd cmd) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.writeCmd(0, cmd);
		return p.contents(buf);
	}

	public static String toString(Block block) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.writeBlock(1, block);
		return p.contents(buf);
	}

	private String contents(ByteArrayOutputStream buf) {
		out.flush();
		String text = new String(buf.toByteArray(), StandardCharsets.UTF_8);
		return text.replace(System.lineSeparator(), "\n").stripTrailing();
	}
}
