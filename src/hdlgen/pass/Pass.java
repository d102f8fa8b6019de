package hdlgen.pass;

import hdlgen.generator.Generator;

/** A transformation or check over the generator tree below a top generator. */
@FunctionalInterface
public interface Pass {
  void run(Generator top);
}
