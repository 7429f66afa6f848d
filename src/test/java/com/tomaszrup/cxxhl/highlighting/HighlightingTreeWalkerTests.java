////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl.highlighting;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.cxxhl.ast.AstNode;
import com.tomaszrup.cxxhl.ast.ConstructorInitializer;
import com.tomaszrup.cxxhl.ast.DeclKind;
import com.tomaszrup.cxxhl.ast.DeclRefExpr;
import com.tomaszrup.cxxhl.ast.DeclarationName;
import com.tomaszrup.cxxhl.ast.DependentScopeDeclRefExpr;
import com.tomaszrup.cxxhl.ast.DependentScopeMemberExpr;
import com.tomaszrup.cxxhl.ast.FunctionDecl;
import com.tomaszrup.cxxhl.ast.MemberExpr;
import com.tomaszrup.cxxhl.ast.NamedDecl;
import com.tomaszrup.cxxhl.ast.NamespaceAliasDecl;
import com.tomaszrup.cxxhl.ast.NestedNameSpecifierLoc;
import com.tomaszrup.cxxhl.ast.OverloadExpr;
import com.tomaszrup.cxxhl.ast.RecordDecl;
import com.tomaszrup.cxxhl.ast.SourceFixture;
import com.tomaszrup.cxxhl.ast.SourceLocation;
import com.tomaszrup.cxxhl.ast.Stmt;
import com.tomaszrup.cxxhl.ast.TemplateDecl;
import com.tomaszrup.cxxhl.ast.TranslationUnit;
import com.tomaszrup.cxxhl.ast.Type;
import com.tomaszrup.cxxhl.ast.TypeLoc;
import com.tomaszrup.cxxhl.ast.TypedefNameDecl;
import com.tomaszrup.cxxhl.ast.UsingDecl;
import com.tomaszrup.cxxhl.ast.VarDecl;

/**
 * Tests for {@link HighlightingTreeWalker}. Trees are built by hand over a
 * small source text, the way the resolver would produce them.
 */
class HighlightingTreeWalkerTests {
	private static final SourceLocation IN_HEADER = SourceLocation.of(SourceFixture.HEADER_FILE, 3, 7);

	private HighlightingDiagnostics diagnostics;

	@BeforeEach
	void setup() {
		diagnostics = new HighlightingDiagnostics();
	}

	private List<HighlightingToken> walk(SourceFixture src, AstNode... topLevel) {
		TranslationUnit unit = new TranslationUnit();
		unit.addChildren(topLevel);
		HighlightingTreeWalker walker = new HighlightingTreeWalker(src.getSourceManager(), diagnostics);
		List<HighlightingToken> tokens = new ArrayList<>(walker.walk(unit));
		Collections.sort(tokens);
		return tokens;
	}

	private static HighlightingToken token(HighlightingKind kind, Range range) {
		return new HighlightingToken(kind, range);
	}

	// ------------------------------------------------------------------
	// declarations and references
	// ------------------------------------------------------------------

	@Test
	void testClassDeclarationAndUse() {
		SourceFixture src = new SourceFixture("class Foo {};\nFoo x;");
		RecordDecl foo = new RecordDecl("Foo", src.loc("Foo"));
		foo.addChild(TypeLoc.tag(src.loc("Foo"), Type.record(foo), true));
		VarDecl x = new VarDecl(DeclarationName.identifier("x"), src.loc("x"), Type.record(foo), src.loc("Foo", 1),
				VarDecl.StorageScope.GLOBAL);
		x.addChild(TypeLoc.tag(src.loc("Foo", 1), Type.record(foo)));

		List<HighlightingToken> tokens = walk(src, foo, x);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.CLASS, src.range("Foo")),
				token(HighlightingKind.CLASS, src.range("Foo", 1)),
				token(HighlightingKind.VARIABLE, src.range("x"))), tokens);
		Assertions.assertFalse(diagnostics.hasProblems());
	}

	@Test
	void testStaticAndInstanceMethodReferences() {
		SourceFixture src = new SourceFixture(""
				+ "struct Counter {\n"
				+ "  static Counter create();\n"
				+ "  int size();\n"
				+ "  void reset() { create(); this->size(); }\n"
				+ "};");
		FunctionDecl create = new FunctionDecl(DeclKind.METHOD, "create", src.loc("create"), true);
		FunctionDecl size = new FunctionDecl(DeclKind.METHOD, "size", src.loc("size"), false);
		FunctionDecl reset = new FunctionDecl(DeclKind.METHOD, "reset", src.loc("reset"), false);
		reset.addChild(new Stmt("compound").addChildren(
				new DeclRefExpr(src.loc("create", 1), create),
				new MemberExpr(src.loc("size", 1), size)));
		RecordDecl counter = new RecordDecl("Counter", src.loc("Counter"));
		counter.addChildren(create, size, reset);

		List<HighlightingToken> tokens = walk(src, counter);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.CLASS, src.range("Counter")),
				token(HighlightingKind.STATIC_METHOD, src.range("create")),
				token(HighlightingKind.METHOD, src.range("size")),
				token(HighlightingKind.METHOD, src.range("reset")),
				token(HighlightingKind.STATIC_METHOD, src.range("create", 1)),
				token(HighlightingKind.METHOD, src.range("size", 1))), tokens);
	}

	@Test
	void testOverloadSets() {
		SourceFixture src = new SourceFixture("obj.get(); obj.value();");
		FunctionDecl get1 = new FunctionDecl(DeclKind.METHOD, "get", IN_HEADER, false);
		FunctionDecl get2 = new FunctionDecl(DeclKind.METHOD, "get", IN_HEADER, false);
		FunctionDecl valueMethod = new FunctionDecl(DeclKind.METHOD, "value", IN_HEADER, false);
		NamedDecl valueField = new NamedDecl(DeclKind.FIELD, "value", IN_HEADER);

		List<HighlightingToken> tokens = walk(src,
				new OverloadExpr("get", src.loc("get"), get1, get2),
				new OverloadExpr("value", src.loc("value"), valueMethod, valueField));

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.METHOD, src.range("get")),
				token(HighlightingKind.DEPENDENT_NAME, src.range("value"))), tokens);
	}

	@Test
	void testDependentNames() {
		SourceFixture src = new SourceFixture("t.template get<0>(); T::value;");

		List<HighlightingToken> tokens = walk(src,
				new DependentScopeMemberExpr("get", src.loc("get")),
				new DependentScopeDeclRefExpr("value", src.loc("value")),
				new DependentScopeDeclRefExpr(DeclarationName.operator("()"), src.loc("T")));

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.DEPENDENT_NAME, src.range("get")),
				token(HighlightingKind.DEPENDENT_NAME, src.range("value"))), tokens);
	}

	@Test
	void testNamesWithoutSpellingAreSkipped() {
		SourceFixture src = new SourceFixture("struct { int v; } s; Foo operator+(Foo); ~Foo();");
		RecordDecl anonymous = new RecordDecl(DeclarationName.anonymous(), src.loc("struct"), false);
		FunctionDecl plus = new FunctionDecl(DeclKind.FUNCTION, DeclarationName.operator("+"), src.loc("operator"),
				null, null, false);
		FunctionDecl dtor = new FunctionDecl(DeclKind.DESTRUCTOR, DeclarationName.destructor("Foo"),
				src.getSourceManager().location(0, 41), null, null, false);

		Assertions.assertEquals(Collections.emptyList(), walk(src, anonymous, plus, dtor));
	}

	@Test
	void testCanHighlightName() {
		Assertions.assertTrue(HighlightingTreeWalker.canHighlightName(DeclarationName.identifier("x")));
		Assertions.assertTrue(HighlightingTreeWalker.canHighlightName(DeclarationName.constructor("Foo")));
		Assertions.assertTrue(HighlightingTreeWalker.canHighlightName(DeclarationName.usingDirective()));
		Assertions.assertFalse(HighlightingTreeWalker.canHighlightName(DeclarationName.anonymous()));
		Assertions.assertFalse(HighlightingTreeWalker.canHighlightName(DeclarationName.destructor("Foo")));
		Assertions.assertFalse(HighlightingTreeWalker.canHighlightName(DeclarationName.operator("==")));
		Assertions.assertFalse(HighlightingTreeWalker.canHighlightName(null));
	}

	@Test
	void testConstructorAndMemberInitializer() {
		SourceFixture src = new SourceFixture("Foo::Foo() : count(0) {}");
		NamedDecl count = new NamedDecl(DeclKind.FIELD, "count", IN_HEADER);
		FunctionDecl ctor = new FunctionDecl(DeclKind.CONSTRUCTOR, DeclarationName.constructor("Foo"),
				src.loc("Foo", 1), null, null, false);
		ctor.addChildren(
				new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.TYPE_SPEC, src.loc("Foo")),
				new ConstructorInitializer(count, src.loc("count")));

		List<HighlightingToken> tokens = walk(src, ctor);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.CLASS, src.range("Foo", 1)),
				token(HighlightingKind.FIELD, src.range("count"))), tokens);
	}

	// ------------------------------------------------------------------
	// namespaces and using declarations
	// ------------------------------------------------------------------

	@Test
	void testNamespaceAlias() {
		SourceFixture src = new SourceFixture("namespace fs = std::filesystem;");
		NamedDecl filesystem = new NamedDecl(DeclKind.NAMESPACE, "filesystem", IN_HEADER);
		NamespaceAliasDecl alias = new NamespaceAliasDecl("fs", src.loc("fs"), filesystem, src.loc("filesystem"));
		alias.addChild(new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.NAMESPACE, src.loc("std")));

		List<HighlightingToken> tokens = walk(src, alias);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.NAMESPACE, src.range("fs")),
				token(HighlightingKind.NAMESPACE, src.range("std")),
				token(HighlightingKind.NAMESPACE, src.range("filesystem"))), tokens);
	}

	@Test
	void testNestedNameSpecifierPrefixes() {
		SourceFixture src = new SourceFixture("::outer::inner::Type::value");
		NestedNameSpecifierLoc global = new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.GLOBAL,
				src.getSourceManager().location(0, 0));
		NestedNameSpecifierLoc outer = new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.NAMESPACE,
				src.loc("outer"), global);
		NestedNameSpecifierLoc inner = new NestedNameSpecifierLoc(
				NestedNameSpecifierLoc.SpecifierKind.NAMESPACE_ALIAS, src.loc("inner"), outer);
		NestedNameSpecifierLoc type = new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.TYPE_SPEC,
				src.loc("Type"), inner);

		List<HighlightingToken> tokens = walk(src, type);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.NAMESPACE, src.range("outer")),
				token(HighlightingKind.NAMESPACE, src.range("inner"))), tokens);
	}

	@Test
	void testUsingDeclarationOfFunctions() {
		SourceFixture src = new SourceFixture("using std::swap;");
		FunctionDecl swap1 = new FunctionDecl(DeclKind.FUNCTION, "swap", IN_HEADER, false);
		FunctionDecl swap2 = new FunctionDecl(DeclKind.FUNCTION, "swap", IN_HEADER, false);
		UsingDecl using = UsingDecl.of("swap", src.loc("swap"), swap1, swap2);
		using.addChild(new NestedNameSpecifierLoc(NestedNameSpecifierLoc.SpecifierKind.NAMESPACE, src.loc("std")));

		List<HighlightingToken> tokens = walk(src, using);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.NAMESPACE, src.range("std")),
				token(HighlightingKind.FUNCTION, src.range("swap"))), tokens);
	}

	@Test
	void testUsingDeclarationWithMixedTargets() {
		SourceFixture src = new SourceFixture("using Base::name;");
		UsingDecl using = UsingDecl.of("name", src.loc("name"),
				new FunctionDecl(DeclKind.METHOD, "name", IN_HEADER, false),
				new NamedDecl(DeclKind.FIELD, "name", IN_HEADER));

		Assertions.assertEquals(Collections.emptyList(), walk(src, using));
	}

	// ------------------------------------------------------------------
	// types
	// ------------------------------------------------------------------

	@Test
	void testDeducedAutoIsHighlightedAsItsType() {
		SourceFixture src = new SourceFixture("auto widget = makeWidget();\nauto n = 1;\nauto m = g();");
		RecordDecl widgetClass = new RecordDecl("Widget", IN_HEADER);
		FunctionDecl makeWidget = new FunctionDecl(DeclKind.FUNCTION, "makeWidget", IN_HEADER, false);
		VarDecl widget = new VarDecl(DeclarationName.identifier("widget"), src.loc("widget"),
				Type.auto(Type.record(widgetClass)), src.loc("auto"), VarDecl.StorageScope.LOCAL);
		widget.addChild(new DeclRefExpr(src.loc("makeWidget"), makeWidget));
		VarDecl n = new VarDecl(DeclarationName.identifier("n"), src.loc("n"),
				Type.auto(Type.builtin("int")), src.loc("auto", 1), VarDecl.StorageScope.LOCAL);
		VarDecl m = new VarDecl(DeclarationName.identifier("m"), src.loc("m"),
				Type.auto(null), src.loc("auto", 2), VarDecl.StorageScope.LOCAL);

		List<HighlightingToken> tokens = walk(src, widget, n, m);

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.CLASS, src.range("auto")),
				token(HighlightingKind.LOCAL_VARIABLE, src.range("widget")),
				token(HighlightingKind.FUNCTION, src.range("makeWidget")),
				token(HighlightingKind.PRIMITIVE, src.range("auto", 1)),
				token(HighlightingKind.LOCAL_VARIABLE, src.range("n")),
				token(HighlightingKind.LOCAL_VARIABLE, src.range("m"))), tokens);
	}

	@Test
	void testTypeLocations() {
		SourceFixture src = new SourceFixture(""
				+ "template <typename T> struct Box {\n"
				+ "  T value;\n"
				+ "  MyInt n;\n"
				+ "  decltype(n) m;\n"
				+ "  typename T::type t;\n"
				+ "};\n"
				+ "Box<int> b;");
		NamedDecl parm = new NamedDecl(DeclKind.TEMPLATE_TYPE_PARM, "T", IN_HEADER);
		TypedefNameDecl myInt = new TypedefNameDecl("MyInt", IN_HEADER, Type.builtin("int"));
		TemplateDecl box = new TemplateDecl(DeclKind.CLASS_TEMPLATE, new RecordDecl("Box", IN_HEADER));

		List<HighlightingToken> tokens = walk(src,
				TypeLoc.templateTypeParm(src.loc("T", 1), parm),
				TypeLoc.typedef(src.loc("MyInt"), myInt),
				TypeLoc.decltype(src.loc("decltype"), Type.decltype(Type.typedef(myInt))),
				TypeLoc.dependentName(src.loc("typename", 1), src.loc("type")),
				TypeLoc.templateSpecialization(src.loc("Box", 1), box),
				TypeLoc.other(src.loc("int"), Type.builtin("int")));

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.TEMPLATE_PARAMETER, src.range("T", 1)),
				token(HighlightingKind.PRIMITIVE, src.range("MyInt")),
				token(HighlightingKind.PRIMITIVE, src.range("decltype")),
				token(HighlightingKind.DEPENDENT_TYPE, src.range("type")),
				token(HighlightingKind.CLASS, src.range("Box", 1))), tokens);
	}

	@Test
	void testTagDefinitionIsNotHighlightedTwice() {
		SourceFixture src = new SourceFixture("enum Color { Red };");
		NamedDecl color = new NamedDecl(DeclKind.ENUM, "Color", src.loc("Color"));
		color.addChildren(
				TypeLoc.tag(src.loc("Color"), Type.enumType(color), true),
				new NamedDecl(DeclKind.ENUM_CONSTANT, "Red", src.loc("Red")));

		Assertions.assertEquals(Arrays.asList(
				token(HighlightingKind.ENUM, src.range("Color")),
				token(HighlightingKind.ENUM_CONSTANT, src.range("Red"))), walk(src, color));
	}

	// ------------------------------------------------------------------
	// location filtering
	// ------------------------------------------------------------------

	@Test
	void testMacroArgumentIsHighlightedAtItsSpelling() {
		SourceFixture src = new SourceFixture("#define ID(x) x\nint value = ID(counter);");
		VarDecl counter = new VarDecl("counter", IN_HEADER, VarDecl.StorageScope.GLOBAL);

		List<HighlightingToken> tokens = walk(src,
				new DeclRefExpr(SourceLocation.macroArgument(src.loc("counter")), counter),
				new DeclRefExpr(SourceLocation.macroBody(src.loc("x", 1)), counter));

		Assertions.assertEquals(Collections.singletonList(
				token(HighlightingKind.VARIABLE, src.range("counter"))), tokens);
	}

	@Test
	void testLocationsOutsideMainFileAreDropped() {
		SourceFixture src = new SourceFixture("int x;");
		VarDecl included = new VarDecl("limit", IN_HEADER, VarDecl.StorageScope.GLOBAL);
		DeclRefExpr spelledInHeader = new DeclRefExpr(SourceLocation.macroArgument(IN_HEADER), included);

		Assertions.assertEquals(Collections.emptyList(), walk(src, included, spelledInHeader));
		Assertions.assertFalse(diagnostics.hasProblems());
	}

	@Test
	void testInvalidLocationsAreSkipped() {
		SourceFixture src = new SourceFixture("int x;");
		VarDecl nowhere = new VarDecl("x", SourceLocation.invalid(), VarDecl.StorageScope.GLOBAL);

		Assertions.assertEquals(Collections.emptyList(), walk(src, nowhere));
		Assertions.assertFalse(diagnostics.hasProblems());
	}

	@Test
	void testMissingTokenRangeIsReported() {
		SourceFixture src = new SourceFixture("int x;");
		SourceLocation onWhitespace = src.getSourceManager().location(0, 3);
		VarDecl x = new VarDecl("x", onWhitespace, VarDecl.StorageScope.GLOBAL);
		VarDecl y = new VarDecl("y", src.loc("x"), VarDecl.StorageScope.GLOBAL);

		List<HighlightingToken> tokens = walk(src, x, y);

		Assertions.assertEquals(Collections.singletonList(token(HighlightingKind.VARIABLE, src.range("x"))), tokens);
		Assertions.assertEquals(1, diagnostics.getProblems().size());
		Assertions.assertTrue(diagnostics.getProblems().get(0).contains(onWhitespace.toString()));
	}

	@Test
	void testWalkerCanBeReused() {
		SourceFixture src = new SourceFixture("int x;");
		TranslationUnit unit = new TranslationUnit();
		unit.addChild(new VarDecl("x", src.loc("x"), VarDecl.StorageScope.GLOBAL));
		HighlightingTreeWalker walker = new HighlightingTreeWalker(src.getSourceManager(), diagnostics);

		Assertions.assertEquals(walker.walk(unit), walker.walk(unit));
		Assertions.assertEquals(1, walker.walk(unit).size());
	}
}
