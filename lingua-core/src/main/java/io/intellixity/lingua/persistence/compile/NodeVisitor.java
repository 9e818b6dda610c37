package io.intellixity.lingua.persistence.compile;

import io.intellixity.lingua.persistence.expr.And;
import io.intellixity.lingua.persistence.expr.Binary;
import io.intellixity.lingua.persistence.expr.Function;
import io.intellixity.lingua.persistence.expr.Leaf;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.NodeList;
import io.intellixity.lingua.persistence.expr.Unary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Class-dispatching visitor over {@link Node} trees.
 * <p>
 * Handlers are registered per node class from constructors. A node whose exact class has no handler uses the
 * handler of its nearest registered superclass; the resolution is memoised per concrete class, so the superclass
 * chain is walked at most once per class for the lifetime of the visitor.
 * <p>
 * Built-in handlers:
 * <ul>
 *   <li>{@link NodeList}, {@link Binary}, {@link Function}, {@link And}: children combined via {@link #visitCollection}</li>
 *   <li>{@link Unary}: the operand</li>
 *   <li>{@link Leaf}: {@link #empty()}</li>
 * </ul>
 * Instances are safe to share between threads once constructed.
 *
 * @param <R> join requirement produced by the walk
 */
public abstract class NodeVisitor<R> {
  private static final Logger log = LoggerFactory.getLogger(NodeVisitor.class);

  @FunctionalInterface
  protected interface Handler<N extends Node, R> {
    R visit(N node);
  }

  private final Map<Class<?>, Handler<Node, R>> handlers = new ConcurrentHashMap<>();
  private final Map<Class<?>, Handler<Node, R>> dispatch = new ConcurrentHashMap<>();
  private final AtomicInteger resolutions = new AtomicInteger();

  protected NodeVisitor() {
    on(NodeList.class, n -> visitCollection(n.children()));
    on(Unary.class, n -> visit(n.expr()));
    on(Binary.class, n -> visitCollection(List.of(n.left(), n.right())));
    on(Function.class, n -> visitCollection(n.expressions()));
    on(And.class, n -> visitCollection(n.children()));
    on(Leaf.class, n -> empty());
  }

  /** Result contributed by nodes that require nothing. */
  protected abstract R empty();

  /** Combines the results of visiting each node. */
  protected abstract R visitCollection(List<? extends Node> nodes);

  /** Registers (or replaces) the handler for {@code type}. Only call from constructors. */
  @SuppressWarnings("unchecked")
  protected final <N extends Node> void on(Class<N> type, Handler<? super N, R> handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    handlers.put(type, (Handler<Node, R>) handler);
  }

  public final R visit(Node node) {
    Objects.requireNonNull(node, "node");
    Class<?> type = node.getClass();
    Handler<Node, R> h = dispatch.get(type);
    if (h == null) h = dispatch.computeIfAbsent(type, this::resolve);
    return h.visit(node);
  }

  /** Number of superclass-chain resolutions performed so far (one per distinct node class). */
  final int resolutions() {
    return resolutions.get();
  }

  private Handler<Node, R> resolve(Class<?> type) {
    resolutions.incrementAndGet();
    for (Class<?> c = type; c != null && Node.class.isAssignableFrom(c); c = c.getSuperclass()) {
      Handler<Node, R> h = handlers.get(c);
      if (h != null) {
        if (log.isTraceEnabled()) {
          log.trace("lingua.dispatch visitor={} nodeClass={} handlerClass={}",
              getClass().getSimpleName(), type.getName(), c.getName());
        }
        return h;
      }
    }
    throw new IllegalArgumentException("Unsupported node: " + type.getName()
        + " (no handler registered for it or any superclass in " + getClass().getSimpleName() + ")");
  }
}
