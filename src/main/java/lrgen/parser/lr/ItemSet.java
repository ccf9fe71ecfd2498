package lrgen.parser.lr;

import java.util.*;

import com.google.common.collect.ImmutableSortedSet;

import lrgen.grammar.Symbol;

/**
 * A state of the LR(1) automaton: a closed set of LR(1) items with an id.
 *
 * Two item sets are equal iff they contain the same items, the id isn't taken into account. The items are
 * stored in their canonical order.
 */
public class ItemSet implements Iterable<LR1Item>, Comparable<ItemSet> {

	public final int id;

	private final ImmutableSortedSet<LR1Item> items;

	public ItemSet(int id, Collection<LR1Item> items) {
		this.id = id;
		this.items = ImmutableSortedSet.copyOf(items);
	}

	public SortedSet<LR1Item> items(){
		return items;
	}

	public int size(){
		return items.size();
	}

	public boolean contains(LR1Item item){
		return items.contains(item);
	}

	@Override
	public Iterator<LR1Item> iterator() {
		return items.iterator();
	}

	/**
	 * Symbols directly after a dot, in symbol order
	 */
	public SortedSet<Symbol> symbolsAfterDot(){
		SortedSet<Symbol> symbols = new TreeSet<>();
		for (LR1Item item : items) {
			if (item.canAdvance()){
				symbols.add(item.nextSymbol());
			}
		}
		return symbols;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ItemSet && ((ItemSet)obj).items.equals(items);
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public int compareTo(ItemSet o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("I").append(id);
		for (LR1Item item : items) {
			builder.append("\n- ").append(item);
		}
		return builder.toString();
	}

	public String toHTMLString(){
		StringBuilder builder = new StringBuilder();
		builder.append("<b>I").append(id).append("</b><br align=\"left\"/>");
		for (LR1Item item : items) {
			builder.append(item.toHTMLString()).append("<br align=\"left\"/>");
		}
		return builder.toString();
	}
}
