package lrgen.parser.lr;

import java.util.logging.Logger;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lrgen.Config;

/**
 * Keeps the generators of the most recently used grammar texts. Failing grammars aren't cached.
 */
public class GeneratorCache {

	private static final Logger LOG = Logger.getLogger("lrgen.generator");

	private final Cache<String, Generator> cache;

	public GeneratorCache(int size) {
		this.cache = CacheBuilder.newBuilder().maximumSize(size).concurrencyLevel(1).build();
	}

	public GeneratorCache() {
		this(Config.cacheSize());
	}

	public Generator getCachedIfPossible(String grammarText){
		Generator generator = cache.getIfPresent(grammarText);
		if (generator != null){
			LOG.finer("Cache hit");
			return generator;
		}
		LOG.finer("Cache miss");
		generator = Generator.fromText(grammarText);
		cache.put(grammarText, generator);
		return generator;
	}

	public long size(){
		return cache.size();
	}

	public void clear(){
		cache.invalidateAll();
	}
}
