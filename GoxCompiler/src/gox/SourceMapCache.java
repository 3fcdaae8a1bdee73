package gox;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Source maps of generated files, keyed by the generated file's normalized absolute path. */
public final class SourceMapCache {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Path, SourceMap> maps = new HashMap<>();

  private static Path key(String generatedFile) {
    return Paths.get(generatedFile).toAbsolutePath().normalize();
  }

  public void put(String generatedFile, SourceMap map) {
    lock.writeLock().lock();
    try {
      maps.put(key(generatedFile), map);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<SourceMap> get(String generatedFile) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(maps.get(key(generatedFile)));
    } finally {
      lock.readLock().unlock();
    }
  }

  public void remove(String generatedFile) {
    lock.writeLock().lock();
    try {
      maps.remove(key(generatedFile));
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return maps.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
