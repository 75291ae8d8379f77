/* @LICENSE@  
 */
package org.dfarx.regex;

import static org.dfarx.regex.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An abstract syntax tree stored in a flat, append-only arena. Nodes refer to
 * their children by id (index into the arena), never directly; a child is
 * always appended before its parent, so the root is the last node added.
 */
final class AST {

    static abstract class Node {
    }

    static final class Leaf extends Node {

        final char letter;

        Leaf(char letter) {
            this.letter = letter;
        }
    }

    static final class LeafCharClass extends Node {

        final CharClass cc;

        LeafCharClass(CharClass cc) {
            assert cc != null;
            this.cc = cc;
        }
    }

    static abstract class Binary extends Node {

        final int first, second;

        private Binary(int first, int second) {
            this.first = first;
            this.second = second;
        }
    }

    /**
     * Concatenation.
     */
    static final class And extends Binary {

        And(int first, int second) {
            super(first, second);
        }
    }

    /**
     * Alternation.
     */
    static final class Or extends Binary {

        Or(int first, int second) {
            super(first, second);
        }
    }

    static abstract class Unary extends Node {

        final int child;

        private Unary(int child) {
            this.child = child;
        }
    }

    static final class RepeatStar extends Unary {

        RepeatStar(int child) {
            super(child);
        }
    }

    static final class RepeatPlus extends Unary {

        RepeatPlus(int child) {
            super(child);
        }
    }

    private final List<Node> nodes = new ArrayList<Node>();

    /**
     * Append a node to the top of the tree.
     * 
     * @return the id of the new node
     */
    int add(Node node) {
        assert new Object() {
            boolean test() {
                if (node instanceof Binary) {
                    Binary b = (Binary) node;
                    return b.first < nodes.size() && b.second < nodes.size();
                } else if (node instanceof Unary) {
                    return ((Unary) node).child < nodes.size();
                }
                return true;
            }
        }.test() : "forward reference";
        nodes.add(node);
        return nodes.size() - 1;
    }

    Node get(int id) {
        return nodes.get(id);
    }

    int rootId() {
        if (nodes.isEmpty()) {
            throw new IllegalStateException("empty tree");
        }
        return nodes.size() - 1;
    }

    Node root() {
        return get(rootId());
    }

    int size() {
        return nodes.size();
    }

    /**
     * Flatten a right leaning chain of one binary operator: for
     * <code>x (y z)</code> with both nodes of the same kind as
     * <code>id</code>, returns <code>[x, y, z]</code>.
     */
    List<Integer> operands(int id) {
        final Class<?> kind = get(id).getClass();
        assert Binary.class.isAssignableFrom(kind) : kind;
        final List<Integer> ret = new ArrayList<Integer>();
        int current = id;
        while (get(current).getClass() == kind) {
            Binary b = (Binary) get(current);
            ret.add(b.first);
            current = b.second;
        }
        ret.add(current);
        return ret;
    }

    /*
     * multi-dispatch over the node kinds: subclasses deal with the
     * granularity they want. "instanceof" dispatch is ugly but it's only in
     * one place - here.
     */
    abstract class Visitor {

        protected void visit(int id) {
            Node node = get(id);
            if (node instanceof Leaf) {
                visit((Leaf) node);
            } else if (node instanceof LeafCharClass) {
                visit((LeafCharClass) node);
            } else if (node instanceof And) {
                visit((And) node);
            } else if (node instanceof Or) {
                visit((Or) node);
            } else if (node instanceof RepeatStar) {
                visit((RepeatStar) node);
            } else if (node instanceof RepeatPlus) {
                visit((RepeatPlus) node);
            } else {
                assert false : "unknown node type " + node;
            }
        }

        protected void visit(Leaf node) {}
        protected void visit(LeafCharClass node) {}
        protected void visit(And node) {}
        protected void visit(Or node) {}
        protected void visit(RepeatStar node) {}
        protected void visit(RepeatPlus node) {}
    }

    /**
     * Renders the tree back into the expression language. Groups are
     * structurally invisible, so parenthesis are put back only where they are
     * needed to re-parse into the same language.
     */
    @Override
    public String toString() {
        if (nodes.isEmpty()) return "";
        final StringBuilder sb = new StringBuilder();
        new Visitor() {

            private void group(int id, boolean paren) {
                if (paren) sb.append('(');
                visit(id);
                if (paren) sb.append(')');
            }

            private boolean isLeaf(int id) {
                return get(id) instanceof Leaf 
                    || get(id) instanceof LeafCharClass;
            }

            @Override
            protected void visit(Leaf node) {
                sb.append(node.letter);
            }

            @Override
            protected void visit(LeafCharClass node) {
                sb.append(node.cc);
            }

            @Override
            protected void visit(int id) {
                if (get(id) instanceof And) {
                    for (int operand : operands(id)) {
                        group(operand, get(operand) instanceof Or);
                    }
                } else if (get(id) instanceof Or) {
                    List<Integer> operands = operands(id);
                    for (int i = 0; i < operands.size(); ++i) {
                        if (i > 0) sb.append('|');
                        int operand = operands.get(i);
                        group(operand, get(operand) instanceof Or);
                    }
                } else {
                    super.visit(id);
                }
            }

            @Override
            protected void visit(RepeatStar node) {
                group(node.child, !isLeaf(node.child));
                sb.append('*');
            }

            @Override
            protected void visit(RepeatPlus node) {
                group(node.child, !isLeaf(node.child));
                sb.append('+');
            }
        }.visit(rootId());
        return sb.toString();
    }

    /**
     * @return an indented rendering of the tree, one node per line, leaves
     *         labeled with their id. A chain of one operator prints as a
     *         single node with all of its operands.
     */
    String toTreeString() {
        if (nodes.isEmpty()) return "";
        final StringBuilder sb = new StringBuilder();
        new Visitor() {

            private int nspace = 0;

            private void line(String label) {
                for (int i = 0; i < nspace; ++i) sb.append(' ');
                sb.append(label).append(LS);
            }

            private void children(Iterable<Integer> ids) {
                nspace += 4;
                for (int id : ids) visit(id);
                nspace -= 4;
            }

            @Override
            protected void visit(int id) {
                Node node = get(id);
                if (node instanceof Leaf) {
                    line(((Leaf) node).letter + " {" + id + '}');
                } else if (node instanceof LeafCharClass) {
                    line(((LeafCharClass) node).cc + " {" + id + '}');
                } else if (node instanceof And) {
                    line("&");
                    children(operands(id));
                } else if (node instanceof Or) {
                    line("|");
                    children(operands(id));
                } else {
                    super.visit(id);
                }
            }

            @Override
            protected void visit(RepeatStar node) {
                line("*");
                children(Collections.singletonList(node.child));
            }

            @Override
            protected void visit(RepeatPlus node) {
                line("+");
                children(Collections.singletonList(node.child));
            }
        }.visit(rootId());
        return sb.toString();
    }
}
