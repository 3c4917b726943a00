/*
 * Copyright 2010 Google Inc.
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

package constraintsystem;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A versioned binary encoding of constraint systems, proof contexts and case
 * distinctions, used to store precomputed case distinctions between runs.
 * Every value decodes to a value equal to the encoded one. The oracle of a
 * proof context is not encoded; it is supplied when decoding.
 * <p>
 * Layout: a version byte, an entity byte, then the entity. Each kind of
 * value is written by its own method below; sum types start with a tag byte.
 */
public final class ConstraintSystemCodec {
  static final byte VERSION = 1;

  private static final byte SYSTEM = 'S';
  private static final byte PROOF_CONTEXT = 'P';
  private static final byte CASE_DISTINCTION = 'C';
  private static final byte CASE_DISTINCTIONS = 'L';

  private ConstraintSystemCodec() {}

  public static byte[] encode(ConstraintSystem sys) {
    Writer out = new Writer(SYSTEM);
    out.writeSystem(sys);
    return out.toByteArray();
  }

  public static ConstraintSystem decodeSystem(byte[] bytes)
      throws IOException {
    Reader in = new Reader(bytes, SYSTEM);
    try {
      return in.finish(in.readSystem());
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  public static byte[] encode(ProofContext ctxt) {
    Writer out = new Writer(PROOF_CONTEXT);
    out.writeProofContext(ctxt);
    return out.toByteArray();
  }

  public static ProofContext decodeProofContext(byte[] bytes,
      EquationalOracle oracle) throws IOException {
    Reader in = new Reader(bytes, PROOF_CONTEXT);
    try {
      return in.finish(in.readProofContext(oracle));
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  public static byte[] encode(CaseDistinction caseDistinction) {
    Writer out = new Writer(CASE_DISTINCTION);
    out.writeCaseDistinction(caseDistinction);
    return out.toByteArray();
  }

  public static CaseDistinction decodeCaseDistinction(byte[] bytes)
      throws IOException {
    Reader in = new Reader(bytes, CASE_DISTINCTION);
    try {
      return in.finish(in.readCaseDistinction());
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  public static byte[] encodeCaseDistinctions(
      List<CaseDistinction> caseDistinctions) {
    Writer out = new Writer(CASE_DISTINCTIONS);
    out.writeInt(caseDistinctions.size());
    for (CaseDistinction caseDistinction : caseDistinctions) {
      out.writeCaseDistinction(caseDistinction);
    }
    return out.toByteArray();
  }

  public static ImmutableList<CaseDistinction> decodeCaseDistinctions(
      byte[] bytes) throws IOException {
    Reader in = new Reader(bytes, CASE_DISTINCTIONS);
    try {
      int n = in.readCount();
      ImmutableList.Builder<CaseDistinction> result = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        result.add(in.readCaseDistinction());
      }
      return in.finish(result.build());
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  private static IOException malformed(RuntimeException e) {
    return new IOException("malformed encoding: " + e.getMessage(), e);
  }

  /** Writes values to a byte array. */
  private static final class Writer {
    private final ByteArrayDataOutput out = ByteStreams.newDataOutput();

    Writer(byte entity) {
      out.writeByte(VERSION);
      out.writeByte(entity);
    }

    byte[] toByteArray() {
      return out.toByteArray();
    }

    void writeInt(int value) {
      out.writeInt(value);
    }

    void writeVar(LVar var) {
      out.writeUTF(var.name());
      out.writeByte(var.sort().ordinal());
      out.writeLong(var.index());
    }

    void writeTerm(Term term) {
      term.accept(new Term.Visitor<Void>() {
        @Override
        public Void visitVar(VarTerm var) {
          out.writeByte(0);
          writeVar(var.var());
          return null;
        }

        @Override
        public Void visitName(NameTerm name) {
          out.writeByte(1);
          out.writeByte(name.kind().ordinal());
          out.writeUTF(name.id());
          return null;
        }

        @Override
        public Void visitFun(FunTerm fun) {
          out.writeByte(2);
          out.writeUTF(fun.symbol());
          out.writeBoolean(fun.isAC());
          out.writeInt(fun.args().size());
          for (Term arg : fun.args()) {
            writeTerm(arg);
          }
          return null;
        }
      });
    }

    void writeFact(Fact fact) {
      FactTag tag = fact.tag();
      out.writeByte(tag.kind().ordinal());
      out.writeUTF(tag.name());
      out.writeInt(tag.arity());
      out.writeBoolean(tag.isPersistent());
      out.writeInt(fact.terms().size());
      for (Term term : fact.terms()) {
        writeTerm(term);
      }
    }

    void writeFacts(List<Fact> facts) {
      out.writeInt(facts.size());
      for (Fact fact : facts) {
        writeFact(fact);
      }
    }

    void writeRule(Rule rule) {
      out.writeByte(rule.name().kind().ordinal());
      out.writeUTF(rule.name().name());
      writeFacts(rule.premises());
      writeFacts(rule.conclusions());
      writeFacts(rule.actions());
    }

    void writeRules(List<Rule> rules) {
      out.writeInt(rules.size());
      for (Rule rule : rules) {
        writeRule(rule);
      }
    }

    void writeNode(NodeId node) {
      writeVar(node.asVar());
    }

    void writeSubstitution(Substitution subst) {
      out.writeInt(subst.asMap().size());
      for (Map.Entry<LVar, Term> entry : subst.asMap().entrySet()) {
        writeVar(entry.getKey());
        writeTerm(entry.getValue());
      }
    }

    void writeAtom(Atom atom) {
      atom.accept(new Atom.Visitor<Void>() {
        @Override
        public Void visitAction(Atom.Action atom) {
          out.writeByte(0);
          writeTerm(atom.node());
          writeFact(atom.fact());
          return null;
        }

        @Override
        public Void visitLess(Atom.Less atom) {
          out.writeByte(1);
          writeTerm(atom.smaller());
          writeTerm(atom.larger());
          return null;
        }

        @Override
        public Void visitEq(Atom.Eq atom) {
          out.writeByte(2);
          writeTerm(atom.left());
          writeTerm(atom.right());
          return null;
        }

        @Override
        public Void visitLast(Atom.Last atom) {
          out.writeByte(3);
          writeTerm(atom.node());
          return null;
        }
      });
    }

    void writeFormula(Guarded formula) {
      formula.accept(new Guarded.Visitor<Void>() {
        @Override
        public Void visitAtom(Guarded.AtomFormula f) {
          out.writeByte(0);
          writeAtom(f.atom());
          return null;
        }

        @Override
        public Void visitNot(Guarded.Not f) {
          out.writeByte(1);
          writeFormula(f.formula());
          return null;
        }

        @Override
        public Void visitConj(Guarded.Conj f) {
          out.writeByte(2);
          writeFormulas(f.formulas());
          return null;
        }

        @Override
        public Void visitDisj(Guarded.Disj f) {
          out.writeByte(3);
          writeFormulas(f.formulas());
          return null;
        }

        @Override
        public Void visitQuantified(Guarded.Quantified f) {
          out.writeByte(4);
          out.writeByte(f.quantifier().ordinal());
          out.writeInt(f.vars().size());
          for (LVar var : f.vars()) {
            writeVar(var);
          }
          out.writeInt(f.guards().size());
          for (Atom guard : f.guards()) {
            writeAtom(guard);
          }
          writeFormula(f.body());
          return null;
        }
      });
    }

    void writeFormulas(Collection<Guarded> formulas) {
      out.writeInt(formulas.size());
      for (Guarded formula : formulas) {
        writeFormula(formula);
      }
    }

    void writeGoal(Goal goal) {
      goal.accept(new Goal.Visitor<Void>() {
        @Override
        public Void visitPremise(PremiseGoal goal) {
          out.writeByte(0);
          writeNode(goal.premise().node());
          out.writeInt(goal.premise().index());
          writeFact(goal.fact());
          return null;
        }

        @Override
        public Void visitAction(ActionGoal goal) {
          out.writeByte(1);
          writeNode(goal.node());
          writeFact(goal.fact());
          return null;
        }

        @Override
        public Void visitChain(ChainGoal goal) {
          out.writeByte(2);
          writeNode(goal.source().node());
          out.writeInt(goal.source().index());
          writeNode(goal.target().node());
          out.writeInt(goal.target().index());
          return null;
        }

        @Override
        public Void visitSplit(SplitGoal goal) {
          out.writeByte(3);
          out.writeInt(goal.splitId().id());
          return null;
        }

        @Override
        public Void visitDisj(DisjGoal goal) {
          out.writeByte(4);
          writeFormulas(goal.disjuncts());
          return null;
        }
      });
    }

    void writeSystem(ConstraintSystem sys) {
      out.writeByte(sys.caseDistKind().ordinal());
      out.writeBoolean(sys.isDiff());
      out.writeInt(sys.nodes().size());
      for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
        writeNode(entry.getKey());
        writeRule(entry.getValue());
      }
      out.writeInt(sys.edges().size());
      for (Edge edge : sys.edges()) {
        writeNode(edge.source().node());
        out.writeInt(edge.source().index());
        writeNode(edge.target().node());
        out.writeInt(edge.target().index());
      }
      out.writeInt(sys.lessAtoms().size());
      for (LessAtom atom : sys.lessAtoms()) {
        writeNode(atom.smaller());
        writeNode(atom.larger());
      }
      out.writeBoolean(sys.lastNode().isPresent());
      if (sys.lastNode().isPresent()) {
        writeNode(sys.lastNode().get());
      }
      EquationStore store = sys.equationStore();
      writeSubstitution(store.substitution());
      out.writeInt(store.disjunctions().size());
      for (Map.Entry<SplitId, ImmutableList<Substitution>> entry
          : store.disjunctions().entrySet()) {
        out.writeInt(entry.getKey().id());
        out.writeInt(entry.getValue().size());
        for (Substitution subst : entry.getValue()) {
          writeSubstitution(subst);
        }
      }
      out.writeInt(store.nextSplitId());
      writeFormulas(sys.formulas());
      writeFormulas(sys.solvedFormulas());
      writeFormulas(sys.lemmas());
      out.writeInt(sys.goals().size());
      for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
        writeGoal(entry.getKey());
        out.writeBoolean(entry.getValue().isSolved());
        out.writeLong(entry.getValue().nr());
        out.writeBoolean(entry.getValue().isLoopBreaker());
      }
      out.writeLong(sys.nextGoalNr());
    }

    void writeCaseDistinction(CaseDistinction caseDistinction) {
      writeGoal(caseDistinction.goal());
      out.writeInt(caseDistinction.cases().size());
      for (CaseDistinction.Case c : caseDistinction.cases()) {
        out.writeInt(c.path().size());
        for (String step : c.path()) {
          out.writeUTF(step);
        }
        writeSystem(c.system());
      }
    }

    void writeProofContext(ProofContext ctxt) {
      writeRules(ctxt.rules().protocol());
      writeRules(ctxt.rules().destruction());
      writeRules(ctxt.rules().construction());
      out.writeInt(ctxt.injectiveFactTags().size());
      for (FactTag tag : ctxt.injectiveFactTags()) {
        out.writeByte(tag.kind().ordinal());
        out.writeUTF(tag.name());
        out.writeInt(tag.arity());
        out.writeBoolean(tag.isPersistent());
      }
      out.writeByte(ctxt.caseDistKind().ordinal());
      out.writeInt(ctxt.caseDistinctions().size());
      for (CaseDistinction caseDistinction : ctxt.caseDistinctions()) {
        writeCaseDistinction(caseDistinction);
      }
      out.writeByte(ctxt.inductionHint().ordinal());
      out.writeByte(ctxt.traceQuantifier().ordinal());
      out.writeBoolean(ctxt.isDiff());
    }
  }

  /** Reads values written by {@link Writer}. */
  private static final class Reader {
    private final ByteArrayDataInput in;
    private final int length;

    Reader(byte[] bytes, byte entity) throws IOException {
      if (bytes.length < 2) {
        throw new IOException("encoding too short: " + bytes.length
            + " bytes");
      }
      if (bytes[0] != VERSION) {
        throw new IOException("unsupported version " + bytes[0]
            + ", expected " + VERSION);
      }
      if (bytes[1] != entity) {
        throw new IOException("expected entity '" + (char) entity
            + "', found '" + (char) bytes[1] + "'");
      }
      this.in = ByteStreams.newDataInput(bytes, 2);
      this.length = bytes.length - 2;
    }

    /** Fails if there are bytes left after {@code value}. */
    <T> T finish(T value) {
      try {
        in.readByte();
      } catch (IllegalStateException e) {
        return value;
      }
      throw new IllegalStateException("trailing bytes after " + length
          + "-byte encoding");
    }

    private <E extends Enum<E>> E readEnum(E[] values) {
      int ordinal = in.readByte();
      if (ordinal < 0 || ordinal >= values.length) {
        throw new IllegalStateException("bad " + values.getClass()
            .getComponentType().getSimpleName() + " ordinal " + ordinal);
      }
      return values[ordinal];
    }

    int readCount() {
      int n = in.readInt();
      if (n < 0) {
        throw new IllegalStateException("negative count " + n);
      }
      return n;
    }

    LVar readVar() {
      String name = in.readUTF();
      Sort sort = readEnum(Sort.values());
      return LVar.create(name, sort, in.readLong());
    }

    Term readTerm() {
      int tag = in.readByte();
      switch (tag) {
        case 0:
          return Term.var(readVar());
        case 1:
          NameTerm.Kind kind = readEnum(NameTerm.Kind.values());
          return NameTerm.create(kind, in.readUTF());
        case 2:
          String symbol = in.readUTF();
          boolean ac = in.readBoolean();
          int n = readCount();
          ImmutableList.Builder<Term> args = ImmutableList.builder();
          for (int i = 0; i < n; i++) {
            args.add(readTerm());
          }
          return FunTerm.create(symbol, ac, args.build());
        default:
          throw new IllegalStateException("bad term tag " + tag);
      }
    }

    FactTag readFactTag() {
      FactTag.Kind kind = readEnum(FactTag.Kind.values());
      String name = in.readUTF();
      int arity = in.readInt();
      return FactTag.create(kind, name, arity, in.readBoolean());
    }

    Fact readFact() {
      FactTag tag = readFactTag();
      int n = readCount();
      ImmutableList.Builder<Term> terms = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        terms.add(readTerm());
      }
      return Fact.create(tag, terms.build());
    }

    ImmutableList<Fact> readFacts() {
      int n = readCount();
      ImmutableList.Builder<Fact> facts = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        facts.add(readFact());
      }
      return facts.build();
    }

    Rule readRule() {
      RuleName.Kind kind = readEnum(RuleName.Kind.values());
      RuleName name = RuleName.create(kind, in.readUTF());
      ImmutableList<Fact> premises = readFacts();
      ImmutableList<Fact> conclusions = readFacts();
      return Rule.create(name, premises, conclusions, readFacts());
    }

    ImmutableList<Rule> readRules() {
      int n = readCount();
      ImmutableList.Builder<Rule> rules = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        rules.add(readRule());
      }
      return rules.build();
    }

    NodeId readNode() {
      return NodeId.of(readVar());
    }

    Substitution readSubstitution() {
      int n = readCount();
      Map<LVar, Term> mappings = Maps.newLinkedHashMap();
      for (int i = 0; i < n; i++) {
        LVar var = readVar();
        mappings.put(var, readTerm());
      }
      return Substitution.create(mappings);
    }

    Atom readAtom() {
      int tag = in.readByte();
      switch (tag) {
        case 0:
          Term node = readTerm();
          return Atom.action(node, readFact());
        case 1:
          Term smaller = readTerm();
          return Atom.less(smaller, readTerm());
        case 2:
          Term left = readTerm();
          return Atom.eq(left, readTerm());
        case 3:
          return Atom.last(readTerm());
        default:
          throw new IllegalStateException("bad atom tag " + tag);
      }
    }

    Guarded readFormula() {
      int tag = in.readByte();
      switch (tag) {
        case 0:
          return new Guarded.AtomFormula(readAtom());
        case 1:
          return new Guarded.Not(readFormula());
        case 2:
          return new Guarded.Conj(readFormulas());
        case 3:
          return new Guarded.Disj(readFormulas());
        case 4:
          Guarded.Quantifier quantifier =
              readEnum(Guarded.Quantifier.values());
          int nVars = readCount();
          ImmutableList.Builder<LVar> vars = ImmutableList.builder();
          for (int i = 0; i < nVars; i++) {
            vars.add(readVar());
          }
          int nGuards = readCount();
          ImmutableList.Builder<Atom> guards = ImmutableList.builder();
          for (int i = 0; i < nGuards; i++) {
            guards.add(readAtom());
          }
          return new Guarded.Quantified(quantifier, vars.build(),
              guards.build(), readFormula());
        default:
          throw new IllegalStateException("bad formula tag " + tag);
      }
    }

    ImmutableList<Guarded> readFormulas() {
      int n = readCount();
      ImmutableList.Builder<Guarded> formulas = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        formulas.add(readFormula());
      }
      return formulas.build();
    }

    Goal readGoal() {
      int tag = in.readByte();
      switch (tag) {
        case 0:
          NodePrem premise = NodePrem.create(readNode(), in.readInt());
          return PremiseGoal.create(premise, readFact());
        case 1:
          NodeId node = readNode();
          return ActionGoal.create(node, readFact());
        case 2:
          NodeConc source = NodeConc.create(readNode(), in.readInt());
          return ChainGoal.create(source,
              NodePrem.create(readNode(), in.readInt()));
        case 3:
          return SplitGoal.create(SplitId.create(in.readInt()));
        case 4:
          return DisjGoal.create(readFormulas());
        default:
          throw new IllegalStateException("bad goal tag " + tag);
      }
    }

    ConstraintSystem readSystem() {
      CaseDistKind kind = readEnum(CaseDistKind.values());
      ConstraintSystem.Builder builder =
          ConstraintSystem.builder(kind, in.readBoolean());

      int nNodes = readCount();
      Map<NodeId, Rule> nodes = Maps.newTreeMap();
      for (int i = 0; i < nNodes; i++) {
        NodeId node = readNode();
        nodes.put(node, readRule());
      }
      int nEdges = readCount();
      List<Edge> edges = Lists.newArrayList();
      for (int i = 0; i < nEdges; i++) {
        NodeConc source = NodeConc.create(readNode(), in.readInt());
        edges.add(Edge.create(source,
            NodePrem.create(readNode(), in.readInt())));
      }
      int nLess = readCount();
      List<LessAtom> lessAtoms = Lists.newArrayList();
      for (int i = 0; i < nLess; i++) {
        NodeId smaller = readNode();
        lessAtoms.add(LessAtom.create(smaller, readNode()));
      }
      Optional<NodeId> lastNode = in.readBoolean()
          ? Optional.of(readNode()) : Optional.<NodeId>absent();

      Substitution subst = readSubstitution();
      int nSplits = readCount();
      Map<SplitId, List<Substitution>> disjunctions = Maps.newTreeMap();
      for (int i = 0; i < nSplits; i++) {
        SplitId id = SplitId.create(in.readInt());
        int nDisjuncts = readCount();
        List<Substitution> disjuncts = Lists.newArrayList();
        for (int j = 0; j < nDisjuncts; j++) {
          disjuncts.add(readSubstitution());
        }
        disjunctions.put(id, disjuncts);
      }
      EquationStore store =
          EquationStore.create(subst, disjunctions, in.readInt());

      ImmutableList<Guarded> formulas = readFormulas();
      ImmutableList<Guarded> solvedFormulas = readFormulas();
      ImmutableList<Guarded> lemmas = readFormulas();
      int nGoals = readCount();
      Map<Goal, GoalStatus> goals = Maps.newLinkedHashMap();
      for (int i = 0; i < nGoals; i++) {
        Goal goal = readGoal();
        boolean solved = in.readBoolean();
        long nr = in.readLong();
        goals.put(goal, GoalStatus.create(solved, nr, in.readBoolean()));
      }
      return builder
          .nodes(nodes)
          .edges(edges)
          .lessAtoms(lessAtoms)
          .lastNode(lastNode)
          .equationStore(store)
          .formulas(formulas)
          .solvedFormulas(solvedFormulas)
          .lemmas(lemmas)
          .goals(goals)
          .nextGoalNr(in.readLong())
          .build();
    }

    CaseDistinction readCaseDistinction() {
      Goal goal = readGoal();
      int nCases = readCount();
      List<CaseDistinction.Case> cases = Lists.newArrayList();
      for (int i = 0; i < nCases; i++) {
        int nSteps = readCount();
        List<String> path = Lists.newArrayList();
        for (int j = 0; j < nSteps; j++) {
          path.add(in.readUTF());
        }
        cases.add(CaseDistinction.Case.create(path, readSystem()));
      }
      return CaseDistinction.create(goal, cases);
    }

    ProofContext readProofContext(EquationalOracle oracle) {
      ImmutableList<Rule> protocol = readRules();
      ImmutableList<Rule> destruction = readRules();
      ImmutableList<Rule> construction = readRules();
      int nTags = readCount();
      List<FactTag> tags = Lists.newArrayList();
      for (int i = 0; i < nTags; i++) {
        tags.add(readFactTag());
      }
      CaseDistKind kind = readEnum(CaseDistKind.values());
      int nCaseDistinctions = readCount();
      List<CaseDistinction> caseDistinctions = Lists.newArrayList();
      for (int i = 0; i < nCaseDistinctions; i++) {
        caseDistinctions.add(readCaseDistinction());
      }
      InductionHint hint = readEnum(InductionHint.values());
      TraceQuantifier quantifier = readEnum(TraceQuantifier.values());
      return ProofContext.builder(oracle)
          .rules(ClassifiedRules.create(protocol, destruction, construction))
          .injectiveFactTags(tags)
          .caseDistKind(kind)
          .caseDistinctions(caseDistinctions)
          .inductionHint(hint)
          .traceQuantifier(quantifier)
          .diff(in.readBoolean())
          .build();
    }
  }
}
