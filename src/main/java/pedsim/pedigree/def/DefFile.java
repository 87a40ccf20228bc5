package pedsim.pedigree.def;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The compiled contents of a def file: its pedigrees, in the order they were defined, and any warnings raised while
 * reading them.
 */
public class DefFile implements Iterable<Pedigree> {
    private final List<Pedigree> pedigrees;
    private final Map<String, Pedigree> byName = new LinkedHashMap<>();
    private final List<DefFileWarning> warnings;

    public DefFile(final List<Pedigree> pedigrees, final List<DefFileWarning> warnings) {
        this.pedigrees = Collections.unmodifiableList(pedigrees);
        this.warnings = Collections.unmodifiableList(warnings);
        for (final Pedigree pedigree : pedigrees) byName.put(pedigree.getName(), pedigree);
    }

    public List<Pedigree> getPedigrees() { return pedigrees; }

    /** The pedigree with the given name, or null. */
    public Pedigree getPedigree(final String name) { return byName.get(name); }

    public int size() { return pedigrees.size(); }

    public List<DefFileWarning> getWarnings() { return warnings; }

    public boolean hasWarnings() { return !warnings.isEmpty(); }

    @Override
    public Iterator<Pedigree> iterator() {
        return pedigrees.iterator();
    }
}
