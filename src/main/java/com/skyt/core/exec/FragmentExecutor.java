package com.skyt.core.exec;

import com.skyt.core.parse.ParsedSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * FragmentExecutor: compiles a fragment in memory and invokes its methods
 * under a wall-clock time box.
 *
 * Each compilation gets its own class loader, so two versions of the same
 * fragment can be loaded side by side. Invocations run on a daemon thread; a
 * call that overruns its time box is interrupted, abandoned and reported as
 * TIMED_OUT. A computation that ignores the interrupt keeps its thread, so
 * abandoned threads are tracked and, while {@code maxRunaways} of them are
 * still alive, further invocations are refused as FAILED instead of piling
 * more threads on the JVM.
 */
@Component
public class FragmentExecutor {

    private static final Logger log = LoggerFactory.getLogger(FragmentExecutor.class);

    private static final List<String> COMPILER_OPTIONS = List.of("-proc:none", "-nowarn", "-g:none");

    public static final int DEFAULT_MAX_RUNAWAYS = 4;

    private final int          maxRunaways;
    private final List<Thread> runaways = new CopyOnWriteArrayList<>();

    public FragmentExecutor() {
        this(DEFAULT_MAX_RUNAWAYS);
    }

    @Autowired
    public FragmentExecutor(@Value("${skyt.exec.max-runaway-threads:" + DEFAULT_MAX_RUNAWAYS + "}") int maxRunaways) {
        if (maxRunaways < 1) {
            throw new IllegalArgumentException("maxRunaways must be >= 1, got " + maxRunaways);
        }
        this.maxRunaways = maxRunaways;
    }

    // =========================================================================
    // Compilation
    // =========================================================================

    public CompilationResult compile(ParsedSource fragment) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            log.warn("[FragmentExecutor] No system compiler available");
            return CompilationResult.unavailable();
        }

        String source   = fragment.compilableSource();
        String fileName = fragment.compilationFileName();

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard =
                compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8);

        try (MemoryFileManager fileManager = new MemoryFileManager(standard)) {
            JavaFileObject unit = new SourceFile(fileName, source);
            Boolean ok = compiler.getTask(null, fileManager, diagnostics, COMPILER_OPTIONS, null, List.of(unit)).call();
            if (!Boolean.TRUE.equals(ok)) {
                String messages = render(diagnostics);
                log.debug("[FragmentExecutor] Compilation failed: {}", messages);
                return CompilationResult.failure(messages);
            }
            MemoryClassLoader loader = new MemoryClassLoader(fileManager.classes(), getClass().getClassLoader());
            Class<?> type = loader.loadClass(fragment.binaryTypeName());
            return CompilationResult.success(type);
        } catch (ClassNotFoundException e) {
            return CompilationResult.failure("Compiled type not found: " + e.getMessage());
        } catch (IOException e) {
            return CompilationResult.failure("File manager error: " + e.getMessage());
        }
    }

    // =========================================================================
    // Invocation
    // =========================================================================

    /**
     * Invokes {@code method} with {@code args}. Instance methods are called on a
     * fresh instance built with the no-arg constructor.
     */
    public InvocationOutcome invoke(Method method, Object[] args, long timeoutMillis) {
        Object target;
        try {
            target = Modifier.isStatic(method.getModifiers()) ? null : newInstance(method.getDeclaringClass());
            method.setAccessible(true);
        } catch (ReflectiveOperationException | RuntimeException e) {
            return InvocationOutcome.failed("Cannot prepare invocation of " + method.getName() + ": " + e);
        }

        int alive = liveRunaways();
        if (alive >= maxRunaways) {
            log.warn("[FragmentExecutor] Refusing {}: {} timed-out invocations still running",
                    method.getName(), alive);
            return InvocationOutcome.failed(alive + " timed-out invocations still running");
        }

        Object receiver = target;
        AtomicReference<Thread> workerThread = new AtomicReference<>();
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "skyt-fragment-" + method.getName());
            thread.setDaemon(true);
            workerThread.set(thread);
            return thread;
        });
        try {
            Future<Object> future = worker.submit(() -> method.invoke(receiver, args));
            return InvocationOutcome.returned(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.debug("[FragmentExecutor] {} timed out after {} ms", method.getName(), timeoutMillis);
            Thread thread = workerThread.get();
            if (thread != null) runaways.add(thread);
            return InvocationOutcome.timedOut(timeoutMillis);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvocationTargetException && cause.getCause() != null) {
                return InvocationOutcome.threw(cause.getCause());
            }
            return InvocationOutcome.failed("Invocation error: " + cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return InvocationOutcome.failed("Interrupted while waiting for " + method.getName());
        } finally {
            worker.shutdownNow();
        }
    }

    /** Timed-out invocation threads that have not finished yet. */
    public int liveRunaways() {
        runaways.removeIf(thread -> !thread.isAlive());
        return runaways.size();
    }

    /** First declared method with the given name, or null. */
    public static Method findMethod(Class<?> type, String name) {
        for (Method method : type.getDeclaredMethods()) {
            if (method.getName().equals(name) && !method.isSynthetic()) return method;
        }
        return null;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static Object newInstance(Class<?> type) throws ReflectiveOperationException {
        Constructor<?> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    private static String render(DiagnosticCollector<JavaFileObject> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() != Diagnostic.Kind.ERROR) continue;
            if (sb.length() > 0) sb.append("; ");
            sb.append("line ").append(d.getLineNumber()).append(": ").append(d.getMessage(null));
        }
        return sb.toString();
    }

    // =========================================================================
    // Inner classes
    // =========================================================================

    private static final class SourceFile extends SimpleJavaFileObject {
        private final String code;

        SourceFile(String fileName, String code) {
            super(URI.create("string:///" + fileName + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return code;
        }
    }

    private static final class ClassFile extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassFile(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }

        byte[] toByteArray() {
            return bytes.toByteArray();
        }
    }

    private static final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ClassFile> outputs = new HashMap<>();

        MemoryFileManager(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(JavaFileManager.Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            ClassFile file = new ClassFile(className);
            outputs.put(className, file);
            return file;
        }

        Map<String, byte[]> classes() {
            Map<String, byte[]> result = new HashMap<>();
            outputs.forEach((name, file) -> result.put(name, file.toByteArray()));
            return result;
        }
    }

    private static final class MemoryClassLoader extends ClassLoader {
        private final Map<String, byte[]> classes;

        MemoryClassLoader(Map<String, byte[]> classes, ClassLoader parent) {
            super(parent);
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classes.get(name);
            if (bytes == null) {
                throw new ClassNotFoundException(name);
            }
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
