package hdlgen.generator;

import hdlgen.except.UserException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Owns every generator of a design. Several generators may share a module name; code generation tells them apart.
 */
public class Context {
  private final ArrayList<Generator> generators = new ArrayList<>();

  /** Creates a generator and registers it with this context. */
  public Generator generator(String name) {
    Generator generator = new Generator(this, name);
    generators.add(generator);
    return generator;
  }

  /** @return all generators in creation order */
  public List<Generator> getGenerators() { return Collections.unmodifiableList(generators); }

  /** @return the generators that are not instantiated anywhere, in creation order */
  public List<Generator> getRoots() {
    return generators.stream().filter(generator -> generator.getParentGenerator() == null).collect(Collectors.toList());
  }

  public List<Generator> findGenerators(String name) {
    return generators.stream().filter(generator -> generator.getName().equals(name)).collect(Collectors.toList());
  }

  /**
   * Looks up a generator by module name.
   * @throws UserException if there is no generator of that name or more than one
   */
  public Generator getGenerator(String name) {
    List<Generator> found = findGenerators(name);
    if (found.isEmpty())
      throw new UserException("no generator named " + name);
    if (found.size() > 1)
      throw new UserException("generator name " + name + " is ambiguous (" + found.size() + " generators)");
    return found.get(0);
  }

  public boolean hasGenerator(String name) { return generators.stream().anyMatch(generator -> generator.getName().equals(name)); }
}
