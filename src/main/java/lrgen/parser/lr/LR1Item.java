package lrgen.parser.lr;

import java.util.List;
import java.util.Objects;

import lrgen.grammar.*;
import lrgen.util.Utils;

/**
 * An LR(1) item <code>[A → α · β, a]</code>: a production, the position of the dot and a lookahead terminal.
 *
 * Immutable, equality and hash code take all three parts into account. The natural order (production id,
 * dot position, lookahead) is used as canonical order of items in item sets.
 */
public class LR1Item implements Comparable<LR1Item> {

	public final Production production;

	/**
	 * The dot is before the $position.th right hand side symbol
	 */
	public final int position;

	public final Terminal lookahead;

	public LR1Item(Production production, int position, Terminal lookahead) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Dot position %d is out of range for %s",
					position, production));
		}
		this.production = production;
		this.position = position;
		this.lookahead = lookahead;
	}

	public NonTerminal left(){
		return production.left;
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	/**
	 * Is the dot at the end of the right hand side?
	 */
	public boolean isComplete(){
		return !canAdvance();
	}

	public LR1Item advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new LR1Item(production, position + 1, lookahead);
	}

	/**
	 * @return symbol directly after the dot or null if the item is complete
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	/**
	 * @return β in <code>[A → α · X β, a]</code>
	 */
	public List<Symbol> restAfterNextSymbol(){
		if (!canAdvance()){
			return production.right.subList(0, 0);
		}
		return production.right.subList(position + 1, production.rightSize());
	}

	public boolean inFrontOfTerminal(){
		return nextSymbol() instanceof Terminal;
	}

	public boolean inFrontOfNonTerminal(){
		return nextSymbol() instanceof NonTerminal;
	}

	public boolean inFrontOf(Symbol symbol){
		return canAdvance() && nextSymbol().equals(symbol);
	}

	public String formatRightSide(){
		StringBuilder builder = new StringBuilder();
		List<Symbol> right = production.right;
		for (int i = 0; i < right.size(); i++) {
			if (i == position){
				builder.append("· ");
			}
			builder.append(right.get(i));
			if (i < right.size() - 1){
				builder.append(" ");
			}
		}
		if (position == right.size()){
			builder.append(right.isEmpty() ? "·" : " ·");
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return "[" + production.left + " → " + formatRightSide() + ", " + lookahead + "]";
	}

	public String toHTMLString(){
		return Utils.escapeHtml(production.left.toString()) + " → " + Utils.escapeHtml(formatRightSide()) + ", "
				+ Utils.escapeHtml(lookahead.toString());
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LR1Item)){
			return false;
		}
		LR1Item other = (LR1Item)obj;
		return other.position == position && other.production.equals(production) && other.lookahead.equals(lookahead);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production.id, position, lookahead.id);
	}

	@Override
	public int compareTo(LR1Item o) {
		if (o.production.id != production.id){
			return Integer.compare(production.id, o.production.id);
		}
		if (o.position != position){
			return Integer.compare(position, o.position);
		}
		return lookahead.compareTo(o.lookahead);
	}
}
