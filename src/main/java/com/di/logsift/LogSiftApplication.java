package com.di.logsift;

import com.di.logsift.runner.LogSiftCommandRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@SpringBootApplication
@EnableAspectJAutoProxy(proxyTargetClass = false)
public class LogSiftApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(LogSiftApplication.class, args);
		// One command per process; the exit code reports its outcome to the caller (or the slice launcher).
		int exitCode = ctx.getBean(LogSiftCommandRunner.class).run(new DefaultApplicationArguments(args));
		System.exit(SpringApplication.exit(ctx, () -> exitCode));
	}
}
