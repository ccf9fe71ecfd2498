package lrgen.util;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	public static String join(Collection<?> objs, String separator){
		return objs.stream().map(Object::toString).collect(Collectors.joining(separator));
	}

	/**
	 * Escapes the text for graphviz html labels.
	 */
	public static String escapeHtml(String text){
		String ret = text + "";
		String[] search = new String[]{"&", "\"", "<", ">"};
		String[] replacement = new String[]{"&amp;", "&quot;", "&lt;", "&gt;"};
		for (int i = 0; i < search.length; i++){
			ret = ret.replace(search[i], replacement[i]);
		}
		return ret;
	}
}
