package info.isaksson.erland.metatree.binding;

import java.util.Optional;

/** Lookup of bindings by language tag. */
public interface BindingRegistry {

    Optional<LanguageBinding<?>> lookup(String language);
}
