package org.athos.unfold;

import org.athos.astnode.*;
import org.athos.astvisitor.CloneVisitor;
import org.athos.astvisitor.MainLoopFinder;
import org.athos.astvisitor.RenameVisitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.athos.unfold.SyncVariables.Role.MBOX;
import static org.athos.unfold.SyncVariables.Role.ROUND;

/**
 * Bounded unfolding of an event loop.
 * <p>
 * The program must contain a main loop whose body is a sequence of
 * statements and "handlers": top-level {@code if} statements whose branch
 * ends in {@code continue}. Unfolding {@code k} times replaces, inside every
 * handler, the jump back to the loop head with a copy of the loop body, so
 * each simulated iteration gets its own generation of the {@code round} and
 * {@code mbox} variables:
 * <pre>
 *   while (1) {                          while (1) {
 *     mbox = havoc(round);                 mbox = havoc(round);
 *     if (round == 1) {                    if (round == 1) {
 *       round = 3;            k = 1          round_0 = 3;
 *       continue;             ====>          mbox_0 = havoc(round_0);
 *     }                                      if (round_0 == 1) {
 *   }                                          round_1 = 3;
 *                                              continue;
 *                                            }
 *                                            continue;
 *                                          }
 *                                        }
 * </pre>
 * Within one scope the {@code mbox} generation lags the {@code round}
 * generation by one: the messages received after round {@code i} was
 * entered are {@code mbox_i}. Generations {@code _0} to {@code _k} are used
 * and declared.
 * <p>
 * A handler without {@code continue} is not expanded, and declarations of
 * unsupported shape are not duplicated. Neither is reported as an error.
 */
public final class LoopUnfolder {
    private static final boolean DEBUG_UNFOLD = Boolean.getBoolean("athos.debug.unfold");

    private final SyncVariables syncVariables;
    /**
     * Copy of the loop body taken before any change; never modified.
     */
    private final List<Node> template;

    private LoopUnfolder(SyncVariables syncVariables, List<Node> template) {
        this.syncVariables = syncVariables;
        this.template = template;
    }

    /**
     * Unfolds the main loop of {@code ast} {@code k} times, in place.
     *
     * @param ast           the program root
     * @param k             number of unfoldings, at least 1
     * @param syncVariables concrete names of the synchronization variables
     * @throws PreconditionException if the program has no main loop or its
     *                               body is not a compound statement
     */
    public static void unfold(Node ast, int k, SyncVariables syncVariables) {
        if (k < 1) {
            throw new IllegalArgumentException("Number of unfoldings must be positive, got " + k);
        }
        WhileNode mainLoop = MainLoopFinder.find(ast);
        if (mainLoop == null) {
            throw new PreconditionException("No main loop found: the program must contain a while statement");
        }
        if (!(mainLoop.body instanceof BlockNode body)) {
            throw new PreconditionException("The body of the main loop at " + mainLoop.location
                    + " must be a compound statement");
        }

        LoopUnfolder unfolder = new LoopUnfolder(syncVariables, CloneVisitor.cloneList(body.elements));

        Set<String> names = new LinkedHashSet<>();
        names.add(syncVariables.name(ROUND));
        names.add(syncVariables.name(MBOX));
        int declared = IteratedDeclarations.declare(ast, names, k + 1);
        if (DEBUG_UNFOLD) {
            System.err.println("DEBUG: unfold k=" + k + " " + syncVariables + ", declared " + declared + " variables");
        }

        for (IfNode handler : handlers(body.elements)) {
            unfolder.expand(handler.thenBranch, 0, k - 1);
        }
    }

    /**
     * Expands one handler branch at the given iteration.
     *
     * @param branch    the true branch of a handler
     * @param iteration generation of the round entered by this branch
     * @param bound     last iteration that is expanded further
     */
    private void expand(Node branch, int iteration, int bound) {
        if (!(branch instanceof BlockNode body)) {
            if (DEBUG_UNFOLD) {
                System.err.println("DEBUG: unfold skips handler branch at " + branch.getLocation() + ": not a block");
            }
            return;
        }

        // The branch reads the messages of the previous round and enters round `iteration`
        Map<String, String> branchRenames = syncVariables.renames(iteration, ROUND);
        if (iteration > 0) {
            branchRenames.putAll(syncVariables.renames(iteration - 1, MBOX));
        }
        renameStatements(body.elements, branchRenames);

        List<Node> iterationBody = CloneVisitor.cloneList(template);
        Map<String, String> iterationRenames = syncVariables.renames(iteration, ROUND, MBOX);
        renameStatements(iterationBody, iterationRenames);
        for (IfNode handler : handlers(iterationBody)) {
            RenameVisitor.rename(handler.condition, iterationRenames);
        }

        List<IfNode> newHandlers = new ArrayList<>();
        List<BlockNode> sites = new ArrayList<>();
        findSpliceSites(body, sites);
        for (BlockNode site : sites) {
            newHandlers.addAll(splice(site, iterationBody));
        }
        if (DEBUG_UNFOLD) {
            System.err.println("DEBUG: unfold iteration " + iteration + " at " + body.location
                    + ": " + sites.size() + " splice sites, " + newHandlers.size() + " new handlers");
        }

        for (IfNode handler : newHandlers) {
            if (bound > iteration) {
                expand(handler.thenBranch, iteration + 1, bound);
            } else if (handler.thenBranch instanceof BlockNode last) {
                Map<String, String> lastRenames = syncVariables.renames(iteration + 1, ROUND);
                lastRenames.putAll(syncVariables.renames(iteration, MBOX));
                renameStatements(last.elements, lastRenames);
            }
        }
    }

    /**
     * Inserts a copy of {@code iterationBody} before every {@code continue}
     * at the top level of {@code site}.
     *
     * @return the handlers contained in the inserted copies
     */
    private static List<IfNode> splice(BlockNode site, List<Node> iterationBody) {
        List<IfNode> inserted = new ArrayList<>();
        List<Node> spliced = new ArrayList<>(site.elements.size() + iterationBody.size());
        for (Node element : site.elements) {
            if (element instanceof ContinueNode) {
                List<Node> copy = CloneVisitor.cloneList(iterationBody);
                spliced.addAll(copy);
                inserted.addAll(handlers(copy));
            }
            spliced.add(element);
        }
        site.elements.clear();
        site.elements.addAll(spliced);
        return inserted;
    }

    /**
     * Collects the blocks under {@code node} that hold a {@code continue} at
     * their top level. Such a block is not searched any deeper.
     */
    private static void findSpliceSites(Node node, List<BlockNode> sites) {
        if (node instanceof BlockNode block) {
            for (Node element : block.elements) {
                if (element instanceof ContinueNode) {
                    sites.add(block);
                    return;
                }
            }
            for (Node element : block.elements) {
                findSpliceSites(element, sites);
            }
        } else if (node instanceof IfNode conditional) {
            findSpliceSites(conditional.thenBranch, sites);
            findSpliceSites(conditional.elseBranch, sites);
        }
    }

    private static void renameStatements(List<Node> statements, Map<String, String> renames) {
        for (Node statement : statements) {
            if (!(statement instanceof IfNode)) {
                RenameVisitor.rename(statement, renames);
            }
        }
    }

    private static List<IfNode> handlers(List<Node> statements) {
        List<IfNode> handlers = new ArrayList<>();
        for (Node statement : statements) {
            if (statement instanceof IfNode handler) {
                handlers.add(handler);
            }
        }
        return handlers;
    }
}
