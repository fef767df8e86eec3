package com.leaprnd.checkpoint;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static com.leaprnd.checkpoint.Migration.DEFAULT_GROUP;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.SOURCE;

@Target(TYPE)
@Retention(SOURCE)
public @interface Migrate {

	String MANIFEST_DIRECTORY = "META-INF/checkpoint/";
	String MANIFEST_EXTENSION = ".units";

	String id();
	String group() default DEFAULT_GROUP;

}
