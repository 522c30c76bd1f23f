package nl.infomedics.perio.error;

import nl.infomedics.perio.model.FlatRecord;

public class UnknownVariantException extends ValidationException {
	private static final long serialVersionUID = 6811290448201745334L;

	private final Object discriminator;

	public UnknownVariantException(Object discriminator) {
		super(FlatRecord.TYPE, discriminator == null
				? "Record has no appointment type (" + FlatRecord.TYPE + ")"
				: "Unknown appointment type: " + discriminator);
		this.discriminator = discriminator;
	}

	public Object getDiscriminator() {
		return discriminator;
	}
}
