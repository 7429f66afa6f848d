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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl.highlighting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.cxxhl.ast.AstNode;
import com.tomaszrup.cxxhl.ast.ConstructorInitializer;
import com.tomaszrup.cxxhl.ast.DeclRefExpr;
import com.tomaszrup.cxxhl.ast.DeclarationName;
import com.tomaszrup.cxxhl.ast.DeclaratorDecl;
import com.tomaszrup.cxxhl.ast.DependentScopeDeclRefExpr;
import com.tomaszrup.cxxhl.ast.DependentScopeMemberExpr;
import com.tomaszrup.cxxhl.ast.MemberExpr;
import com.tomaszrup.cxxhl.ast.NamedDecl;
import com.tomaszrup.cxxhl.ast.NamespaceAliasDecl;
import com.tomaszrup.cxxhl.ast.NestedNameSpecifierLoc;
import com.tomaszrup.cxxhl.ast.OverloadExpr;
import com.tomaszrup.cxxhl.ast.SourceLocation;
import com.tomaszrup.cxxhl.ast.SourceManager;
import com.tomaszrup.cxxhl.ast.TranslationUnit;
import com.tomaszrup.cxxhl.ast.Type;
import com.tomaszrup.cxxhl.ast.TypeLoc;
import com.tomaszrup.cxxhl.ast.UsingDecl;

/**
 * Walks a resolved tree once and emits a raw token for every highlightable
 * name that is spelled in the primary file. The result is unsorted and may
 * contain duplicates and conflicts; {@link HighlightingTokenCollector} cleans
 * it up.
 *
 * <p>One walker is used for one tree.</p>
 */
public class HighlightingTreeWalker {
	private final SourceManager sourceManager;
	private final HighlightingDiagnostics diagnostics;
	private final List<HighlightingToken> tokens = new ArrayList<>();

	public HighlightingTreeWalker(SourceManager sourceManager, HighlightingDiagnostics diagnostics) {
		this.sourceManager = sourceManager;
		this.diagnostics = diagnostics;
	}

	public List<HighlightingToken> walk(TranslationUnit unit) {
		tokens.clear();
		Deque<AstNode> pending = new ArrayDeque<>();
		pending.push(unit);
		while (!pending.isEmpty()) {
			AstNode node = pending.pop();
			visit(node);
			List<AstNode> children = node.getChildren();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(children.get(i));
			}
		}
		return new ArrayList<>(tokens);
	}

	/**
	 * Names that are not written in the source, e.g. of anonymous classes,
	 * cannot be highlighted. Constructor and using-directive names count as
	 * written.
	 */
	static boolean canHighlightName(DeclarationName name) {
		if (name == null) {
			return false;
		}
		switch (name.getNameKind()) {
			case CONSTRUCTOR_NAME:
			case USING_DIRECTIVE:
				return true;
			case IDENTIFIER: {
				String identifier = name.getAsIdentifier();
				return identifier != null && !identifier.isEmpty();
			}
			default:
				return false;
		}
	}

	private void visit(AstNode node) {
		switch (node.getNodeKind()) {
			case DECL:
				visitNamedDecl((NamedDecl) node);
				break;
			case DECL_REF_EXPR:
				visitDeclRefExpr((DeclRefExpr) node);
				break;
			case MEMBER_EXPR:
				visitMemberExpr((MemberExpr) node);
				break;
			case OVERLOAD_EXPR:
				visitOverloadExpr((OverloadExpr) node);
				break;
			case DEPENDENT_SCOPE_DECL_REF_EXPR:
				visitDependentScopeDeclRefExpr((DependentScopeDeclRefExpr) node);
				break;
			case DEPENDENT_SCOPE_MEMBER_EXPR:
				visitDependentScopeMemberExpr((DependentScopeMemberExpr) node);
				break;
			case TYPEDEF_TYPE_LOC:
			case TEMPLATE_SPECIALIZATION_TYPE_LOC:
				visitNamedTypeLoc((TypeLoc) node);
				break;
			case TAG_TYPE_LOC:
				visitTagTypeLoc((TypeLoc) node);
				break;
			case DECLTYPE_TYPE_LOC:
				visitDecltypeTypeLoc((TypeLoc) node);
				break;
			case DEPENDENT_NAME_TYPE_LOC:
				addToken(((TypeLoc) node).getNameLoc(), HighlightingKind.DEPENDENT_TYPE);
				break;
			case TEMPLATE_TYPE_PARM_TYPE_LOC:
				addToken(((TypeLoc) node).getBeginLoc(), HighlightingKind.TEMPLATE_PARAMETER);
				break;
			case NESTED_NAME_SPECIFIER_LOC:
				visitNestedNameSpecifierLoc((NestedNameSpecifierLoc) node);
				break;
			case CONSTRUCTOR_INITIALIZER:
				visitConstructorInitializer((ConstructorInitializer) node);
				break;
			case TRANSLATION_UNIT:
			case STMT:
			case OTHER_TYPE_LOC:
				break;
		}
	}

	private void visitNamedDecl(NamedDecl decl) {
		if (canHighlightName(decl.getDeclName())) {
			addToken(decl.getLocation(), decl);
		}
		if (decl instanceof NamespaceAliasDecl) {
			// the aliased namespace is not referenced from anywhere else in the tree
			NamespaceAliasDecl alias = (NamespaceAliasDecl) decl;
			addToken(alias.getTargetNameLoc(), alias.getAliasedNamespace());
		} else if (decl instanceof UsingDecl) {
			KindClassifier.kindForCandidateDecls(((UsingDecl) decl).shadows())
					.ifPresent(kind -> addToken(decl.getLocation(), kind));
		}
		if (decl instanceof DeclaratorDecl) {
			visitDeclaratorDecl((DeclaratorDecl) decl);
		}
	}

	/**
	 * Highlights {@code auto} as the type it was deduced to.
	 */
	private void visitDeclaratorDecl(DeclaratorDecl decl) {
		Type type = decl.getType();
		Type auto = type != null ? type.getContainedAutoType() : null;
		if (auto == null) {
			return;
		}
		KindClassifier.kindForType(auto.getDeducedType())
				.ifPresent(kind -> addToken(decl.getTypeSpecStartLoc(), kind));
	}

	private void visitDeclRefExpr(DeclRefExpr ref) {
		if (canHighlightName(ref.getName())) {
			addToken(ref.getLocation(), ref.getDecl());
		}
	}

	private void visitMemberExpr(MemberExpr member) {
		if (canHighlightName(member.getMemberName())) {
			addToken(member.getMemberLoc(), member.getMemberDecl());
		}
	}

	private void visitOverloadExpr(OverloadExpr overload) {
		if (canHighlightName(overload.getName())) {
			HighlightingKind kind = KindClassifier.kindForCandidateDecls(overload.decls())
					.orElse(HighlightingKind.DEPENDENT_NAME);
			addToken(overload.getNameLoc(), kind);
		}
	}

	private void visitDependentScopeDeclRefExpr(DependentScopeDeclRefExpr ref) {
		if (canHighlightName(ref.getDeclName())) {
			addToken(ref.getLocation(), HighlightingKind.DEPENDENT_NAME);
		}
	}

	private void visitDependentScopeMemberExpr(DependentScopeMemberExpr member) {
		if (canHighlightName(member.getMember())) {
			addToken(member.getMemberLoc(), HighlightingKind.DEPENDENT_NAME);
		}
	}

	/** Typedef names and template specializations are highlighted as the declaration they name. */
	private void visitNamedTypeLoc(TypeLoc typeLoc) {
		if (typeLoc.getNamedDecl() != null) {
			addToken(typeLoc.getBeginLoc(), typeLoc.getNamedDecl());
		}
	}

	private void visitTagTypeLoc(TypeLoc typeLoc) {
		if (typeLoc.isDefinition()) {
			// already highlighted through the declaration itself
			return;
		}
		KindClassifier.kindForType(typeLoc.getType()).ifPresent(kind -> addToken(typeLoc.getBeginLoc(), kind));
	}

	private void visitDecltypeTypeLoc(TypeLoc typeLoc) {
		KindClassifier.kindForType(typeLoc.getType()).ifPresent(kind -> addToken(typeLoc.getBeginLoc(), kind));
	}

	private void visitNestedNameSpecifierLoc(NestedNameSpecifierLoc specifier) {
		NestedNameSpecifierLoc.SpecifierKind kind = specifier.getSpecifierKind();
		if (kind == NestedNameSpecifierLoc.SpecifierKind.NAMESPACE
				|| kind == NestedNameSpecifierLoc.SpecifierKind.NAMESPACE_ALIAS) {
			addToken(specifier.getLocalBeginLoc(), HighlightingKind.NAMESPACE);
		}
	}

	private void visitConstructorInitializer(ConstructorInitializer initializer) {
		if (initializer.getMember() != null) {
			addToken(initializer.getSourceLocation(), initializer.getMember());
		}
	}

	private void addToken(SourceLocation location, NamedDecl decl) {
		KindClassifier.kindForDecl(decl).ifPresent(kind -> addToken(location, kind));
	}

	private void addToken(SourceLocation location, HighlightingKind kind) {
		if (location == null || !location.isValid()) {
			return;
		}
		SourceLocation loc = location;
		if (loc.isMacroID()) {
			// only arguments of a macro invocation are highlighted token by token
			if (!sourceManager.isMacroArgExpansion(loc)) {
				return;
			}
			loc = sourceManager.getSpellingLoc(loc);
		}
		// included declarations and macro spellings outside the primary file
		if (!sourceManager.isInsideMainFile(loc)) {
			return;
		}
		Optional<Range> range = sourceManager.getTokenRange(loc);
		if (!range.isPresent()) {
			diagnostics.invalidRange(loc);
			return;
		}
		tokens.add(new HighlightingToken(kind, range.get()));
	}
}
